package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags idle auditorium time: a late first show after the window opens, and gaps
 * between the end of one show and the start of the next in the same auditorium.
 */
@Component
public class DowntimeAnalyzer {

    static final int GAP_MINUTES = 45;
    static final int HUGE_GAP_MINUTES = 90;
    static final int LATE_MINUTES = 105;

    public enum Kind { LATE, GAP, HUGE_GAP }

    public record Issue(String auditoriumName, Kind kind, String message, long minutes, String duration) {}

    public List<Issue> analyze(List<Show> shows, Instant windowStart, LocalDate day, ZoneId zone) {
        Map<Integer, List<Show>> byAud = new LinkedHashMap<>();
        for (Show s : shows) {
            if (s.audId() == null) continue;
            byAud.computeIfAbsent(s.audId(), k -> new ArrayList<>()).add(s);
        }

        List<Issue> issues = new ArrayList<>();
        Instant openAt = TimeUtils.normalize(windowStart, day, zone);
        byAud.forEach((audId, list) -> {
            list.sort(Comparator.comparing(s -> TimeUtils.normalize(s.start(), day, zone)));
            Show firstShow = list.get(0);
            String name = firstShow.audName() == null || firstShow.audName().isEmpty()
                    ? "Aud " + audId : firstShow.audName();

            long late = TimeUtils.minutesBetween(TimeUtils.normalize(firstShow.start(), day, zone), openAt);
            if (late >= LATE_MINUTES) {
                String duration = TimeUtils.formatDuration(late);
                issues.add(new Issue(name, Kind.LATE, name + ": slot before first show from "
                        + TimeUtils.to12(windowStart, zone) + " to " + TimeUtils.to12(firstShow.start(), zone)
                        + " (" + duration + ")", late, duration));
            }

            for (int i = 0; i + 1 < list.size(); i++) {
                Show cur = list.get(i);
                Show next = list.get(i + 1);
                long gap = TimeUtils.minutesBetween(TimeUtils.normalize(next.start(), day, zone),
                        TimeUtils.normalize(cur.end(), day, zone));
                if (gap < GAP_MINUTES) continue;
                String duration = TimeUtils.formatDuration(gap);
                issues.add(new Issue(name, gap >= HUGE_GAP_MINUTES ? Kind.HUGE_GAP : Kind.GAP,
                        name + ": gap from " + TimeUtils.to12(cur.end(), zone) + " to "
                                + TimeUtils.to12(next.start(), zone) + " (" + duration + ")", gap, duration));
            }
        });
        issues.sort(Comparator.comparingLong(Issue::minutes).reversed());
        return issues;
    }
}
