package com.ammann.sleep.enumeration;

import java.util.Optional;

/**
 * Night events reported by the vendor as offsets in seconds from the start of the night.
 */
public enum NightEventType
{
    GOT_IN_BED("1", "Got in Bed"),
    FELL_ASLEEP("2", "Fell Asleep"),
    WOKE_UP("3", "Woke Up"),
    GOT_OUT_OF_BED("4", "Got out of Bed");

    private final String code;
    private final String displayName;

    NightEventType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public static Optional<NightEventType> fromCode(String code) {
        for (NightEventType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String getCode() { return code; }

    public String getDisplayName() { return displayName; }
}
