/* (C)2026 */
package com.ammann.sleep.enumeration;

/**
 * Column layouts of the night summary export. Both layouts re-import through the normalizer.
 */
public enum TabularLayout {
    /** {@code startdate_utc}/{@code enddate_utc} with unprefixed metric columns. */
    CANONICAL,
    /** Every vendor column carries the configured prefix, e.g. {@code w_startdate}. */
    PREFIXED
}
