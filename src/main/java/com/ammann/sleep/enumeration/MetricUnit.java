/* (C)2026 */
package com.ammann.sleep.enumeration;

/**
 * Display unit of a summary metric together with the conversion from its raw value.
 *
 * <p>Durations arrive in seconds, efficiencies as a fraction in [0, 1].
 */
public enum MetricUnit {
    HOURS("hours", "_hours", 1.0, 3600.0),
    MINUTES("minutes", "_minutes", 1.0, 60.0),
    PERCENT("%", "_percent", 100.0, 1.0),
    NONE("", "", 1.0, 1.0);

    private final String symbol;
    private final String derivedSuffix;
    private final double multiplier;
    private final double divisor;

    MetricUnit(String symbol, String derivedSuffix, double multiplier, double divisor) {
        this.symbol = symbol;
        this.derivedSuffix = derivedSuffix;
        this.multiplier = multiplier;
        this.divisor = divisor;
    }

    public double convert(double raw) {
        return raw * multiplier / divisor;
    }

    /** Name of the derived field holding the converted value, e.g. {@code total_sleep_time_hours}. */
    public String derivedName(String field) {
        return field + derivedSuffix;
    }

    public boolean isConverted() {
        return this != NONE;
    }

    public String getSymbol() {
        return symbol;
    }
}
