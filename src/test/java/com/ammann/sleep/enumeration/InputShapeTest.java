package com.ammann.sleep.enumeration;

import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InputShapeTest
{

    @Test
    void prefixedStartDateWinsOverOtherColumns()
    {
        assertThat(InputShape.detect(Set.of("w_startdate", "startdate", "startdate_utc"), "w_"))
                .contains(InputShape.PREFIXED_TABULAR);
    }

    @Test
    void detectsCanonicalAndApiShapes()
    {
        assertThat(InputShape.detect(Set.of("id", "startdate_utc", "enddate_utc"), "w_"))
                .contains(InputShape.CANONICAL_TABULAR);
        assertThat(InputShape.detect(Set.of("id", "startdate", "enddate", "data"), "w_"))
                .contains(InputShape.API);
    }

    @Test
    void honoursConfiguredPrefix()
    {
        assertThat(InputShape.detect(Set.of("x_startdate"), "x_")).contains(InputShape.PREFIXED_TABULAR);
        assertThat(InputShape.detect(Set.of("x_startdate"), "w_")).isEmpty();
    }

    @Test
    void unknownColumnsYieldNoShape()
    {
        assertThat(InputShape.detect(Set.of("id", "date"), "w_")).isEmpty();
        assertThat(InputShape.detect(Set.of(), "w_")).isEmpty();
    }
}
