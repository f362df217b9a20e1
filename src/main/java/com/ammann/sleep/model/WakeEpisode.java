/* (C)2026 */
package com.ammann.sleep.model;

import java.time.Instant;

/**
 * An extended period awake within a night, clipped into the night's interval.
 *
 * @param nightId         id of the owning night
 * @param start           first awake instant
 * @param end             last awake instant, or the night end when the run reached it
 * @param durationSeconds {@code end - start} in seconds, at least 600
 */
public record WakeEpisode(
        String nightId,
        Instant start,
        Instant end,
        long durationSeconds
) {}
