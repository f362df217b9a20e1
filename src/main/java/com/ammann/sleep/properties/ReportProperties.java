/* (C)2026 */
package com.ammann.sleep.properties;

/**
 * Centralized registry of configuration keys and fixed column names used across the report
 * stages.
 */
public final class ReportProperties {

    private ReportProperties() {}

    /**
     * Configuration keys (see {@code application.properties}).
     */
    public static final class Config {
        private Config() {}

        public static final String APPLY_TIMEZONE = "sleep.report.apply-timezone";
        public static final String TABULAR_PREFIX = "sleep.report.tabular.prefix";
        public static final String NAP_FILTER_ENABLED = "sleep.report.nap-filter.enabled";
        public static final String NAP_FILTER_MIN_HOURS = "sleep.report.nap-filter.min-hours";
        public static final String PARALLEL_NIGHTS = "sleep.report.parallel-nights";
    }

    /**
     * Identity and timing columns of a night summary row.
     */
    public static final class Columns {
        private Columns() {}

        public static final String ID = "id";
        public static final String TIMEZONE = "timezone";
        public static final String LAB_ID = "lab_id";
        public static final String START_DATE = "startdate";
        public static final String END_DATE = "enddate";
        public static final String START_DATE_UTC = "startdate_utc";
        public static final String END_DATE_UTC = "enddate_utc";
        public static final String DATA = "data";
    }

    /**
     * Columns of the epoch export that are not per-metric.
     */
    public static final class EpochColumns {
        private EpochColumns() {}

        public static final String ID = "id";
        public static final String TIMESTAMP = "timestamp";
        public static final String STATE = "state";
    }

    /**
     * Pipeline stage names used as warning sources and metric tags.
     */
    public static final class Stages {
        private Stages() {}

        public static final String NORMALIZE = "normalize";
        public static final String FLATTEN = "flatten";
        public static final String IMPORT = "import";
        public static final String TIMING = "timing";
    }

    /** Default prefix of the prefixed tabular export. */
    public static final String DEFAULT_TABULAR_PREFIX = "w_";

    /** Minimum length of a retained wake episode. */
    public static final long MIN_WAKE_EPISODE_SECONDS = 600L;

    /** Name of the executor used for per-night fan-out. */
    public static final String NIGHT_EXECUTOR = "night-analysis-executor";
}
