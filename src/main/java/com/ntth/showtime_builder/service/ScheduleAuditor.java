package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Auditorium;
import com.ntth.showtime_builder.pojo.Film;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/** Read-only reports over the resolved shows of one day. */
@Component
public class ScheduleAuditor {

    static final int SHORT_GAP_MINUTES = 30;
    static final int SHORT_CLEAN_MINUTES = 20;

    private final DowntimeAnalyzer analyzer;

    public ScheduleAuditor(DowntimeAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public record FilmLine(String film, String start, String auditorium, String gapToNext, boolean shortGap) {}

    public record HousePlacement(String film, List<String> houses) {}

    public record AuditoriumSummary(String auditorium, Integer seats, int shows, String firstShow, String lastShow) {}

    public record FeatureSummary(String film, int prints, int shows, String firstShow, String lastShow) {}

    public record AuditReport(List<FilmLine> byFilm,
                              List<HousePlacement> housePlacement,
                              List<AuditoriumSummary> perAuditorium,
                              List<FeatureSummary> perFeature) {}

    public record OrderLine(Show show, String start, Long cleanMinutes, String cleanGap, boolean shortClean) {}

    public record FlaggedCounts(int late, int gap, int hugeGap) {}

    public AuditReport audit(ScheduleSession session, List<Show> shows) {
        ZoneId zone = session.zone();
        // base film title -> shows, alphabetical
        Map<String, List<Show>> byTitle = new TreeMap<>();
        for (Show s : shows) {
            String title = session.catalog().filmById(s.filmId()).map(Film::getTitle)
                    .orElse(s.filmTitle() == null ? "" : s.filmTitle());
            byTitle.computeIfAbsent(title, k -> new ArrayList<>()).add(s);
        }
        byTitle.values().forEach(list -> list.sort(Comparator.comparing(Show::start)));

        List<FilmLine> byFilm = new ArrayList<>();
        List<HousePlacement> houses = new ArrayList<>();
        List<FeatureSummary> features = new ArrayList<>();
        byTitle.forEach((title, list) -> {
            Set<String> placed = new LinkedHashSet<>();
            Set<Integer> prints = new LinkedHashSet<>();
            for (int i = 0; i < list.size(); i++) {
                Show s = list.get(i);
                String gap = "";
                boolean shortGap = false;
                if (i + 1 < list.size()) {
                    long mins = TimeUtils.minutesBetween(list.get(i + 1).start(), s.start());
                    gap = TimeUtils.formatGap(mins);
                    shortGap = mins < SHORT_GAP_MINUTES;
                }
                byFilm.add(new FilmLine(title, TimeUtils.to12(s.start(), zone), nameOf(s), gap, shortGap));
                Optional<Auditorium> aud = session.catalog().auditoriumById(s.audId());
                placed.add(aud.map(a -> a.getSeats() == null ? a.getName() : a.getName() + " (" + a.getSeats() + ")")
                        .orElse(nameOf(s)));
                prints.add(s.audId());
            }
            houses.add(new HousePlacement(title, new ArrayList<>(placed)));
            features.add(new FeatureSummary(title, prints.size(), list.size(),
                    TimeUtils.to12(list.get(0).start(), zone),
                    TimeUtils.to12(list.get(list.size() - 1).start(), zone)));
        });

        Map<String, List<Show>> byAud = new TreeMap<>();
        Map<String, Integer> seats = new LinkedHashMap<>();
        for (Show s : shows) {
            Optional<Auditorium> aud = session.catalog().auditoriumById(s.audId());
            String name = aud.map(Auditorium::getName).orElse(nameOf(s));
            byAud.computeIfAbsent(name, k -> new ArrayList<>()).add(s);
            aud.ifPresent(a -> seats.put(name, a.getSeats()));
        }
        List<AuditoriumSummary> perAud = new ArrayList<>();
        byAud.forEach((name, list) -> {
            list.sort(Comparator.comparing(Show::start));
            perAud.add(new AuditoriumSummary(name, seats.get(name), list.size(),
                    TimeUtils.to12(list.get(0).start(), zone),
                    TimeUtils.to12(list.get(list.size() - 1).start(), zone)));
        });
        return new AuditReport(byFilm, houses, perAud, features);
    }

    /** All shows in start order, each with the clean time left before the next show in its auditorium. */
    public List<OrderLine> startTimeOrder(ScheduleSession session, List<Show> shows) {
        LocalDate day = session.date();
        ZoneId zone = session.zone();
        List<Show> ordered = new ArrayList<>(shows);
        ordered.sort(Comparator.comparing(s -> TimeUtils.normalize(s.start(), day, zone)));

        List<OrderLine> lines = new ArrayList<>();
        for (Show cur : ordered) {
            Instant curStart = TimeUtils.normalize(cur.start(), day, zone);
            Show next = null;
            for (Show other : ordered) {
                if (other.audId() == null || !other.audId().equals(cur.audId())) continue;
                if (TimeUtils.normalize(other.start(), day, zone).isAfter(curStart)) {
                    next = other;
                    break;
                }
            }
            if (next == null) {
                lines.add(new OrderLine(cur, TimeUtils.to12(cur.start(), zone), null, "", false));
                continue;
            }
            long clean = TimeUtils.minutesBetween(TimeUtils.normalize(next.start(), day, zone),
                    TimeUtils.normalize(cur.end(), day, zone));
            lines.add(new OrderLine(cur, TimeUtils.to12(cur.start(), zone), clean,
                    TimeUtils.formatCleanGap(clean), clean < SHORT_CLEAN_MINUTES));
        }
        return lines;
    }

    public FlaggedCounts flaggedCounts(List<DowntimeAnalyzer.Issue> issues) {
        int late = 0, gap = 0, huge = 0;
        for (DowntimeAnalyzer.Issue i : issues) {
            switch (i.kind()) {
                case LATE -> late++;
                case GAP -> gap++;
                case HUGE_GAP -> huge++;
            }
        }
        return new FlaggedCounts(late, gap, huge);
    }

    public List<DowntimeAnalyzer.Issue> issues(ScheduleSession session, List<Show> shows) {
        return session.window().bounds(session.date(), session.zone())
                .map(b -> analyzer.analyze(shows, b.first(), session.date(), session.zone()))
                .orElse(List.of());
    }

    private static String nameOf(Show s) {
        return s.audName() == null || s.audName().isEmpty() ? "Aud " + s.audId() : s.audName();
    }
}
