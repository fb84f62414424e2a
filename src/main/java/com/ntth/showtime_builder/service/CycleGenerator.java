package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Auditorium;
import com.ntth.showtime_builder.pojo.Film;
import com.ntth.showtime_builder.pojo.OperatingWindow;
import com.ntth.showtime_builder.pojo.RowRef;
import com.ntth.showtime_builder.pojo.ScheduleRow;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.pojo.ShowSource;
import com.ntth.showtime_builder.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Steps a row's prime show backwards and forwards by the film's cycle length,
 * keeping the steps that fall inside the operating window.
 */
@Component
public class CycleGenerator {

    static final int MAX_STEPS = 50;

    public List<Show> generate(ScheduleRow row, ScheduleSession session) {
        Optional<Film> film = session.catalog().filmById(row.getFilmId());
        Optional<Auditorium> aud = session.catalog().auditoriumById(row.getAudId());
        Optional<LocalTime> primeHM = TimeUtils.parseHM(row.getPrimeHM());
        if (film.isEmpty() || aud.isEmpty() || primeHM.isEmpty()) {
            return Collections.emptyList();
        }
        int cycle = film.get().cycleMinutes();
        if (cycle <= 0) {
            return Collections.emptyList();
        }
        Optional<OperatingWindow.Bounds> window = session.window().bounds(session.date(), session.zone());
        if (window.isEmpty() || window.get().last().isBefore(window.get().first())) {
            return Collections.emptyList();
        }
        Instant first = window.get().first();
        Instant last = window.get().last();
        Instant prime = TimeUtils.operatingInstant(session.date(), primeHM.get(), session.zone());

        long preCount = Math.min(MAX_STEPS, Math.floorDiv(TimeUtils.minutesBetween(prime, first), cycle));
        long postCount = Math.min(MAX_STEPS, Math.floorDiv(TimeUtils.minutesBetween(last, prime), cycle));

        List<Show> out = new ArrayList<>();
        for (long i = preCount; i >= 1; i--) {
            Instant start = TimeUtils.plusMinutes(prime, -i * cycle);
            if (start.isBefore(first)) continue;
            out.add(show(row, (int) -i, start, film.get(), aud.get()));
        }
        // the prime show is kept even outside the window
        out.add(show(row, 0, prime, film.get(), aud.get()));
        for (long i = 1; i <= postCount; i++) {
            Instant start = TimeUtils.plusMinutes(prime, i * cycle);
            if (start.isAfter(last)) continue;
            out.add(show(row, (int) i, start, film.get(), aud.get()));
        }
        return out;
    }

    private static Show show(ScheduleRow row, int offset, Instant start, Film film, Auditorium aud) {
        return Show.builder()
                .id(row.getRowId() + ":" + offset)
                .rowRef(new RowRef.Static(row.getRowId()))
                .offset(offset)
                .audId(aud.getId())
                .audName(aud.getName())
                .filmId(film.getId())
                .filmTitle(film.displayTitle())
                .start(start)
                .end(TimeUtils.plusMinutes(start, film.showMinutes()))
                .runtimeMin(nz(film.getRuntimeMin()))
                .trailerMin(nz(film.getTrailerMin()))
                .cleanMin(nz(film.getCleanMin()))
                .cycleMinutes(film.cycleMinutes())
                .source(ShowSource.PRIME)
                .build();
    }

    static int nz(Integer v) {
        return v == null ? 0 : v;
    }
}
