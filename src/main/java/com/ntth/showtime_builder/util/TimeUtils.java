package com.ntth.showtime_builder.util;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wall-clock helpers shared by the generator, the resolver and the analyzers.
 * <p>
 * A show day runs from 05:00 to 04:59 of the next calendar day: a time before
 * {@link #ROLLOVER_HOUR} belongs to the previous show day.
 */
public final class TimeUtils {

    public static final int ROLLOVER_HOUR = 5;

    private static final Pattern HM = Pattern.compile("^(\\d{1,2}):(\\d{1,2})$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern US_DATE = Pattern.compile("^(\\d{1,2})[/-](\\d{1,2})[/-](\\d{4})$");
    private static final DateTimeFormatter HHMM = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter MMDDYYYY = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private TimeUtils() {
    }

    /** "19:05" -> 19:05; components are clamped to 23 / 59. Anything else is empty. */
    public static Optional<LocalTime> parseHM(String hm) {
        if (hm == null) return Optional.empty();
        Matcher m = HM.matcher(hm.trim());
        if (!m.matches()) return Optional.empty();
        int h = Math.min(23, Integer.parseInt(m.group(1)));
        int mm = Math.min(59, Integer.parseInt(m.group(2)));
        return Optional.of(LocalTime.of(h, mm));
    }

    public static String formatHM(LocalTime t) {
        return t.format(HHMM);
    }

    public static String hmOf(Instant t, ZoneId zone) {
        return t.atZone(zone).toLocalTime().format(HHMM);
    }

    /** The given wall-clock time on the given calendar day, never rolled over. */
    public static Instant atDay(LocalDate day, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(day, time, zone).toInstant();
    }

    /** The given wall-clock time on the show day {@code day}: times before 05:00 land on the next calendar day. */
    public static Instant operatingInstant(LocalDate day, LocalTime time, ZoneId zone) {
        LocalDate calendarDay = time.getHour() < ROLLOVER_HOUR ? day.plusDays(1) : day;
        return atDay(calendarDay, time, zone);
    }

    /**
     * Moves an instant that sits before 05:00 on the calendar date of the show day
     * to the next day, so that it sorts after the evening shows. Instants already on
     * a later date are left alone, which makes the operation idempotent.
     */
    public static Instant normalize(Instant t, LocalDate day, ZoneId zone) {
        ZonedDateTime z = t.atZone(zone);
        if (z.getHour() < ROLLOVER_HOUR && z.toLocalDate().equals(day)) {
            return z.plusDays(1).toInstant();
        }
        return t;
    }

    /** {@code a - b} in whole minutes. */
    public static long minutesBetween(Instant a, Instant b) {
        return Math.round((a.toEpochMilli() - b.toEpochMilli()) / 60000.0);
    }

    public static Instant plusMinutes(Instant t, long minutes) {
        return t.plus(Duration.ofMinutes(minutes));
    }

    public static int roundUpTo5(int minutes) {
        return (int) Math.ceil(minutes / 5.0) * 5;
    }

    /** 12-hour clock, e.g. "7:05pm", "12:30am". */
    public static String to12(Instant t, ZoneId zone) {
        return to12(t.atZone(zone).toLocalTime());
    }

    public static String to12(LocalTime t) {
        int h = t.getHour();
        String suffix = h >= 12 ? "pm" : "am";
        int h12 = h % 12 == 0 ? 12 : h % 12;
        return h12 + ":" + String.format("%02d", t.getMinute()) + suffix;
    }

    /** 130 -> "2h10m". */
    public static String formatDuration(long minutes) {
        return (minutes / 60) + "h" + String.format("%02d", Math.abs(minutes % 60)) + "m";
    }

    /** 95 -> "1:35" (start-to-start gaps). */
    public static String formatGap(long minutes) {
        return (minutes / 60) + ":" + String.format("%02d", Math.abs(minutes % 60));
    }

    /** Clean gap label: "45m" below an hour, "1h05m" above. */
    public static String formatCleanGap(long minutes) {
        if (minutes >= 60) return formatDuration(minutes);
        return minutes + "m";
    }

    /** Accepts ISO ("2025-08-19") or US style ("8/19/2025", "08-19-2025"). */
    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String s = value.trim();
        try {
            if (ISO_DATE.matcher(s).matches()) {
                return Optional.of(LocalDate.parse(s));
            }
            Matcher m = US_DATE.matcher(s);
            if (!m.matches()) return Optional.empty();
            return Optional.of(LocalDate.of(Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static String toMmdd(LocalDate date) {
        return date.format(MMDDYYYY);
    }
}
