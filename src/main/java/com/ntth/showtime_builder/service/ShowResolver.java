package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Catalog;
import com.ntth.showtime_builder.pojo.Film;
import com.ntth.showtime_builder.pojo.ManualShow;
import com.ntth.showtime_builder.pojo.RowRef;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.pojo.ShowOverride;
import com.ntth.showtime_builder.pojo.ShowSource;
import com.ntth.showtime_builder.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns rows, manual shows, overrides and hidden markers into the flat list of
 * visible shows. This is the only place that decides which shows exist.
 */
@Component
public class ShowResolver {

    private final CycleGenerator generator;

    public ShowResolver(CycleGenerator generator) {
        this.generator = generator;
    }

    public List<Show> resolve(ScheduleSession session) {
        ScheduleSnapshot snap = session.snapshot();
        List<Show> effective = new ArrayList<>();
        for (Show show : baseShows(session)) {
            if (snap.getHiddenShows().contains(show.id())) continue;
            ShowOverride ov = snap.getOverrides().get(show.id());
            effective.add(ov == null ? show : applyOverride(show, ov, session.catalog()));
        }
        effective.sort(Comparator.comparing(Show::start));

        List<Show> unique = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Show s : effective) {
            String key = s.start().toEpochMilli() + "_" + s.audId() + "_" + s.filmId();
            if (seen.add(key)) unique.add(s);
        }
        return unique;
    }

    /** Generated and manual shows before overrides and hiding, in row order. */
    public List<Show> baseShows(ScheduleSession session) {
        List<Show> raw = new ArrayList<>();
        session.snapshot().allRows().forEach(row -> raw.addAll(generator.generate(row, session)));
        session.snapshot().getManualShows().stream()
                .filter(m -> m.getStart() != null)
                .map(ShowResolver::fromManual)
                .forEach(raw::add);
        return raw;
    }

    public Optional<Show> findBase(ScheduleSession session, String showId) {
        return baseShows(session).stream().filter(s -> s.id().equals(showId)).findFirst();
    }

    public Optional<Show> findEffective(ScheduleSession session, String showId) {
        return resolve(session).stream().filter(s -> s.id().equals(showId)).findFirst();
    }

    Show applyOverride(Show base, ShowOverride ov, Catalog catalog) {
        Show.ShowBuilder b = base.toBuilder();
        Show current = base;
        if (ov.start() != null) {
            int minutes = catalog.filmById(ov.filmId()).map(Film::showMinutes)
                    .orElse(base.runtimeMin() + base.trailerMin());
            current = b.start(ov.start()).end(TimeUtils.plusMinutes(ov.start(), minutes)).build();
        }
        if (ov.audId() != null) {
            current = b.audId(ov.audId()).audName(catalog.auditoriumById(ov.audId())
                    .map(a -> a.getName()).orElse(current.audName())).build();
        }
        if (ov.filmId() != null && !ov.filmId().equals(base.filmId())) {
            Optional<Film> film = catalog.filmById(ov.filmId());
            if (film.isPresent()) {
                Film f = film.get();
                current = b.filmId(f.getId())
                        .filmTitle(f.displayTitle())
                        .runtimeMin(CycleGenerator.nz(f.getRuntimeMin()))
                        .trailerMin(CycleGenerator.nz(f.getTrailerMin()))
                        .cleanMin(CycleGenerator.nz(f.getCleanMin()))
                        .cycleMinutes(f.cycleMinutes())
                        .end(TimeUtils.plusMinutes(current.start(), f.showMinutes()))
                        .build();
            }
        }
        boolean movedAud = ov.audId() != null && !ov.audId().equals(base.audId());
        boolean movedFilm = ov.filmId() != null && !ov.filmId().equals(base.filmId());
        if (movedAud || movedFilm) {
            current = b.rowRef(new RowRef.Dynamic(current.audId(), current.filmId()))
                    .source(ShowSource.OVERRIDE)
                    .build();
        }
        return current;
    }

    static Show fromManual(ManualShow m) {
        return Show.builder()
                .id(m.getId())
                .rowRef(new RowRef.Static(Objects.toString(m.getRowId(), "")))
                .audId(m.getAudId())
                .audName(m.getAudName())
                .filmId(m.getFilmId())
                .filmTitle(m.getFilmTitle())
                .start(m.getStart())
                .end(m.getEnd() == null ? m.getStart() : m.getEnd())
                .runtimeMin(m.getRuntimeMin())
                .trailerMin(m.getTrailerMin())
                .cleanMin(m.getCleanMin())
                .cycleMinutes(m.getCycleMinutes())
                .source(ShowSource.MANUAL)
                .build();
    }
}
