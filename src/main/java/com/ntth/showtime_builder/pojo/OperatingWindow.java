package com.ntth.showtime_builder.pojo;

import com.ntth.showtime_builder.util.TimeUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Optional;

/** First and last show times of the day as "HH:MM"; a last show before 05:00 is after midnight. */
public record OperatingWindow(String firstHM, String lastHM) {

    public Optional<Bounds> bounds(LocalDate day, ZoneId zone) {
        Optional<LocalTime> first = TimeUtils.parseHM(firstHM);
        Optional<LocalTime> last = TimeUtils.parseHM(lastHM);
        if (first.isEmpty() || last.isEmpty()) return Optional.empty();
        return Optional.of(new Bounds(
                TimeUtils.atDay(day, first.get(), zone),
                TimeUtils.operatingInstant(day, last.get(), zone)));
    }

    public record Bounds(Instant first, Instant last) {
        public boolean contains(Instant t) {
            return !t.isBefore(first) && !t.isAfter(last);
        }
    }
}
