package com.ammann.sleep.enumeration;

/**
 * Kind of a per-night chart description.
 */
public enum ChartKind
{
    SLEEP_STAGES,
    METRIC_LINE
}
