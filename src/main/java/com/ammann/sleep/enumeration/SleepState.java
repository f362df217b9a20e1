package com.ammann.sleep.enumeration;

import java.util.Optional;

/**
 * Sleep stage reported for every epoch of a night.
 */
public enum SleepState
{
    AWAKE(0, "Awake"),
    LIGHT(1, "Light"),
    DEEP(2, "Deep"),
    REM(3, "REM");

    private final int code;
    private final String displayName;

    SleepState(int code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Resolves a vendor state code.
     *
     * @param code numeric state, may be null
     * @return the matching state, empty for null or unknown codes
     */
    public static Optional<SleepState> fromCode(Integer code) {
        if (code == null) {
            return Optional.empty();
        }
        for (SleepState state : values()) {
            if (state.code == code) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }

    public int getCode() { return code; }

    public String getDisplayName() { return displayName; }
}
