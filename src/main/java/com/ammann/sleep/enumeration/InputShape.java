/* (C)2026 */
package com.ammann.sleep.enumeration;

import java.util.Optional;
import java.util.Set;

/**
 * The closed set of summary input shapes accepted by the normalizer.
 *
 * <p>The shape is decided once per batch from the union of column/key names, checked in
 * declaration order: a prefixed tabular export carries {@code <prefix>startdate}, a canonical
 * export carries {@code startdate_utc} and a vendor API response carries {@code startdate}.
 */
public enum InputShape {
    PREFIXED_TABULAR,
    CANONICAL_TABULAR,
    API;

    public static final String START_DATE = "startdate";
    public static final String START_DATE_UTC = "startdate_utc";

    /**
     * Detects the shape of a batch.
     *
     * @param columns union of keys over all rows
     * @param prefix  marker of the prefixed tabular export, e.g. {@code w_}
     * @return detected shape, empty when none matches
     */
    public static Optional<InputShape> detect(Set<String> columns, String prefix) {
        if (columns == null || columns.isEmpty()) {
            return Optional.empty();
        }
        if (prefix != null && !prefix.isEmpty() && columns.contains(prefix + START_DATE)) {
            return Optional.of(PREFIXED_TABULAR);
        }
        if (columns.contains(START_DATE_UTC)) {
            return Optional.of(CANONICAL_TABULAR);
        }
        if (columns.contains(START_DATE)) {
            return Optional.of(API);
        }
        return Optional.empty();
    }
}
