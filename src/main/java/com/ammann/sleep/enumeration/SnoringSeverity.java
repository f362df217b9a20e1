package com.ammann.sleep.enumeration;

/**
 * Snoring severity derived from the snoring time of a night in minutes.
 */
public enum SnoringSeverity
{
    /** No snoring at all. */
    NONE("none", 0.0),
    /** Up to 15 minutes. */
    MILD("mild", 15.0),
    /** Up to 30 minutes. */
    MODERATE("moderate", 30.0),
    /** Up to one hour. */
    HEAVY("heavy", 60.0),
    /** More than one hour. */
    SEVERE("severe", Double.POSITIVE_INFINITY);

    private final String label;
    private final double upperBound;

    SnoringSeverity(String label, double upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    /**
     * Returns the severity for the given snoring time. Non-positive values count as no snoring.
     *
     * @param minutes snoring time in minutes
     * @return matching severity
     */
    public static SnoringSeverity fromMinutes(double minutes) {
        if (minutes <= NONE.upperBound) return NONE;
        if (minutes <= MILD.upperBound) return MILD;
        if (minutes <= MODERATE.upperBound) return MODERATE;
        if (minutes <= HEAVY.upperBound) return HEAVY;
        return SEVERE;
    }

    public String getLabel() { return label; }

    public double getUpperBound() { return upperBound; }
}
