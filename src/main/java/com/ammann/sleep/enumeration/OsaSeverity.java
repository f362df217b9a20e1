package com.ammann.sleep.enumeration;

/**
 * Obstructive sleep apnea severity derived from the apnea-hypopnea index (events per hour).
 *
 * <p>Each level defines an inclusive upper bound. An index is classified into the first
 * level whose bound it does not exceed.
 */
public enum OsaSeverity
{
    /** AHI of 5 or below. */
    NONE_MINIMAL("none/minimal", 5.0),
    /** AHI above 5 and up to 15. */
    MILD("mild", 15.0),
    /** AHI above 15 and up to 30. */
    MODERATE("moderate", 30.0),
    /** AHI above 30. */
    SEVERE("severe", Double.POSITIVE_INFINITY);

    private final String label;
    private final double upperBound;

    OsaSeverity(String label, double upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    /**
     * Returns the severity corresponding to the given index.
     *
     * @param ahi apnea-hypopnea index
     * @return the first severity whose upper bound is not exceeded
     */
    public static OsaSeverity fromAhi(double ahi) {
        if (ahi <= NONE_MINIMAL.upperBound) return NONE_MINIMAL;
        if (ahi <= MILD.upperBound) return MILD;
        if (ahi <= MODERATE.upperBound) return MODERATE;
        return SEVERE;
    }

    public String getLabel() { return label; }

    public double getUpperBound() { return upperBound; }
}
