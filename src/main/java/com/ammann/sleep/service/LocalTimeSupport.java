/* (C)2026 */
package com.ammann.sleep.service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import org.jboss.logging.Logger;

/**
 * Local-time helpers shared by the layout, chart and statistics services.
 *
 * <p>The timeline axis counts minutes from local noon: noon is 0, midnight 720 and the
 * following 11:59 is 1439.
 */
public final class LocalTimeSupport {

    private static final Logger LOG = Logger.getLogger(LocalTimeSupport.class);

    public static final int MINUTES_PER_DAY = 1440;
    public static final int NOON_MINUTES = 720;

    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    static final DateTimeFormatter DATE_TIME_MINUTES = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    static final DateTimeFormatter DATE_TIME_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private LocalTimeSupport() {}

    /**
     * Resolves the zone a night's local times are computed in.
     *
     * @param timezone      IANA name, may be null or invalid
     * @param applyTimezone false to use UTC for every night
     * @return the night's zone, UTC when disabled, missing or invalid
     */
    public static ZoneId resolveZone(String timezone, boolean applyTimezone) {
        if (!applyTimezone || timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            LOG.debugf("Unknown timezone '%s', falling back to UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    /**
     * Position of an instant on the minutes-from-noon axis, in [0, 1440). Only the local hour
     * and minute count; seconds are dropped.
     */
    public static double minutesFromNoon(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        int minuteOfDay = local.getHour() * 60 + local.getMinute();
        return ((minuteOfDay - NOON_MINUTES) + MINUTES_PER_DAY) % MINUTES_PER_DAY;
    }

    /** Moves an offset that lies before {@code base} onto the following day of the axis. */
    public static double alignAfter(double offset, double base) {
        return offset < base ? offset + MINUTES_PER_DAY : offset;
    }

    /** Converts a minutes-from-noon value back to minutes after local midnight. */
    public static int toMinuteOfDay(double minutesFromNoon) {
        return Math.floorMod((int) Math.round(minutesFromNoon) + NOON_MINUTES, MINUTES_PER_DAY);
    }

    public static LocalDate localDate(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }

    public static String formatDate(Instant instant, ZoneId zone) {
        return DATE.format(instant.atZone(zone));
    }

    public static String formatMinutes(Instant instant, ZoneId zone) {
        return instant == null ? null : DATE_TIME_MINUTES.format(instant.atZone(zone));
    }

    public static String formatSeconds(Instant instant, ZoneId zone) {
        return DATE_TIME_SECONDS.format(instant.atZone(zone));
    }

    /**
     * 12-hour clock label of an hourly tick on the axis, e.g. {@code 12PM} for 0 and
     * {@code 12AM} for 720.
     */
    public static String tickLabel(int tickMinutes) {
        int hour24 = Math.floorMod(Math.floorDiv(tickMinutes + NOON_MINUTES, 60), 24);
        int hour12 = hour24 % 12 == 0 ? 12 : hour24 % 12;
        return hour12 + (hour24 < 12 ? "AM" : "PM");
    }
}
