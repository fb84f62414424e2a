package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Auditorium;
import com.ntth.showtime_builder.pojo.Booking;
import com.ntth.showtime_builder.pojo.Film;
import com.ntth.showtime_builder.pojo.ManualShow;
import com.ntth.showtime_builder.pojo.OperatingWindow;
import com.ntth.showtime_builder.pojo.ScheduleRow;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.pojo.ShowOverride;
import com.ntth.showtime_builder.pojo.UndoEntry;
import com.ntth.showtime_builder.util.TimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Mutation entry points of the schedule. Show edits record exactly one undo entry
 * and do nothing when the requested value is already the effective one; unknown
 * ids and malformed times are ignored. Each show edit answers with the show as it
 * resolves afterwards (empty once hidden or unknown).
 */
@Component
public class ShowEditor {
    private static final Logger log = LoggerFactory.getLogger(ShowEditor.class);

    static final int NUDGE_MINUTES = 5;
    static final int OPTIONS_SPAN_MINUTES = 90;

    private final ShowResolver resolver;

    public ShowEditor(ShowResolver resolver) {
        this.resolver = resolver;
    }

    /** A blank value hides the show; otherwise the show moves to {@code hm} on the show day. */
    public Optional<Show> setStart(ScheduleSession session, String showId, String hm) {
        Optional<Show> current = resolver.findEffective(session, showId);
        if (current.isEmpty() || hm == null) return current;
        ScheduleSnapshot snap = session.snapshot();

        if (hm.isBlank()) {
            snap.pushUndo(new UndoEntry.Hide(showId, snap.getHiddenShows().contains(showId)));
            snap.getHiddenShows().add(showId);
            log.debug("Hid show {}", showId);
            return Optional.empty();
        }
        Optional<LocalTime> time = TimeUtils.parseHM(hm);
        if (time.isEmpty()) return current;
        Instant newStart = TimeUtils.operatingInstant(session.date(), time.get(), session.zone());
        if (newStart.equals(current.get().start())) return current;

        Instant previous = snap.overrideFor(showId).map(ShowOverride::start).orElse(current.get().start());
        snap.pushUndo(new UndoEntry.Edit(showId, previous));
        snap.patchOverride(showId, ov -> ov.withStart(newStart));
        log.debug("Moved show {} to {}", showId, hm);
        return resolver.findEffective(session, showId);
    }

    /**
     * Moves a show to another auditorium. Manual shows are edited in place; generated
     * shows get an override, and {@code null} clears that override.
     */
    public Optional<Show> setAuditorium(ScheduleSession session, String showId, Integer audId) {
        Optional<Show> current = resolver.findEffective(session, showId);
        if (current.isEmpty()) return current;
        if (audId != null && session.catalog().auditoriumById(audId).isEmpty()) return current;
        ScheduleSnapshot snap = session.snapshot();

        Optional<ManualShow> manual = snap.findManualShow(showId);
        if (manual.isPresent()) {
            Integer previous = manual.get().getAudId();
            Integer target = audId == null ? previous : audId;
            if (Objects.equals(target, previous)) return current;
            snap.pushUndo(new UndoEntry.MoveAuditorium(showId, previous));
            manual.get().setAudId(target);
            manual.get().setAudName(session.catalog().auditoriumById(target).map(Auditorium::getName).orElse(""));
            log.debug("Moved manual show {} to auditorium {}", showId, target);
            return resolver.findEffective(session, showId);
        }

        Optional<ShowOverride> ov = snap.overrideFor(showId);
        Integer previous = ov.map(ShowOverride::audId).orElse(current.get().audId());
        if (audId == null) {
            if (ov.isPresent() && ov.get().audId() != null) {
                snap.pushUndo(new UndoEntry.MoveAuditorium(showId, previous));
                snap.patchOverride(showId, o -> o.withAudId(null));
                log.debug("Cleared auditorium override of show {}", showId);
            }
            return resolver.findEffective(session, showId);
        }
        if (audId.equals(previous)) return current;
        snap.pushUndo(new UndoEntry.MoveAuditorium(showId, previous));
        snap.patchOverride(showId, o -> o.withAudId(audId));
        log.debug("Moved show {} to auditorium {}", showId, audId);
        return resolver.findEffective(session, showId);
    }

    /** Same contract as {@link #setAuditorium}, for the film; a manual show cannot lose its film. */
    public Optional<Show> setFilm(ScheduleSession session, String showId, String filmId) {
        Optional<Show> current = resolver.findEffective(session, showId);
        if (current.isEmpty()) return current;
        String target = filmId == null || filmId.isBlank() ? null : filmId;
        Optional<Film> film = session.catalog().filmById(target);
        if (target != null && film.isEmpty()) return current;
        ScheduleSnapshot snap = session.snapshot();

        Optional<ShowOverride> ov = snap.overrideFor(showId);
        String previous = ov.map(ShowOverride::filmId).orElse(current.get().filmId());
        if (Objects.equals(target, previous)) return current;

        Optional<ManualShow> manual = snap.findManualShow(showId);
        if (manual.isPresent()) {
            if (target == null) return current;
            snap.pushUndo(new UndoEntry.EditFilm(showId, manual.get().getFilmId()));
            manual.get().assignFilm(film.get());
            log.debug("Changed film of manual show {} to {}", showId, target);
            return resolver.findEffective(session, showId);
        }

        if (target == null) {
            if (ov.isPresent() && ov.get().filmId() != null) {
                snap.pushUndo(new UndoEntry.EditFilm(showId, previous));
                snap.patchOverride(showId, o -> o.withFilmId(null));
                log.debug("Cleared film override of show {}", showId);
            }
            return resolver.findEffective(session, showId);
        }
        snap.pushUndo(new UndoEntry.EditFilm(showId, previous));
        snap.patchOverride(showId, o -> o.withFilmId(target));
        log.debug("Changed film of show {} to {}", showId, target);
        return resolver.findEffective(session, showId);
    }

    /** Adds a one-off show on a row at {@code hm}; the row needs a known film and auditorium. */
    public Optional<Show> addManualShow(ScheduleSession session, String rowId, String hm) {
        ScheduleSnapshot snap = session.snapshot();
        Optional<ScheduleRow> row = snap.findRow(rowId);
        if (row.isEmpty()) return Optional.empty();
        Optional<Film> film = session.catalog().filmById(row.get().getFilmId());
        Optional<Auditorium> aud = session.catalog().auditoriumById(row.get().getAudId());
        Optional<LocalTime> time = TimeUtils.parseHM(hm);
        if (film.isEmpty() || aud.isEmpty() || time.isEmpty()) return Optional.empty();

        ManualShow ms = new ManualShow();
        ms.setId("M-" + System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(1000));
        ms.setRowId(rowId);
        ms.setAudId(aud.get().getId());
        ms.setAudName(aud.get().getName());
        ms.setStart(TimeUtils.operatingInstant(session.date(), time.get(), session.zone()));
        ms.assignFilm(film.get());
        snap.getManualShows().add(ms);
        snap.pushUndo(new UndoEntry.ManualInsert(new ManualShow(ms)));
        log.debug("Added manual show {} on row {} at {}", ms.getId(), rowId, hm);
        return resolver.findEffective(session, ms.getId());
    }

    /** Start times offered for a show: 5-minute steps within 90 minutes either side, inside the window. */
    public List<String> startOptions(ScheduleSession session, String showId) {
        Optional<Show> show = resolver.findEffective(session, showId);
        Optional<OperatingWindow.Bounds> bounds = session.window().bounds(session.date(), session.zone());
        if (show.isEmpty() || bounds.isEmpty()) return List.of();
        Set<String> options = new LinkedHashSet<>();
        for (int m = -OPTIONS_SPAN_MINUTES; m <= OPTIONS_SPAN_MINUTES; m += NUDGE_MINUTES) {
            Instant t = TimeUtils.plusMinutes(show.get().start(), m);
            if (bounds.get().contains(t)) options.add(TimeUtils.hmOf(t, session.zone()));
        }
        return new ArrayList<>(options);
    }

    /** Shifts a show five minutes earlier ({@code direction < 0}) or later. */
    public Optional<Show> nudge(ScheduleSession session, String showId, int direction) {
        Optional<Show> show = resolver.findEffective(session, showId);
        if (show.isEmpty() || direction == 0) return show;
        Instant target = TimeUtils.plusMinutes(show.get().start(), Integer.signum(direction) * NUDGE_MINUTES);
        return setStart(session, showId, TimeUtils.hmOf(target, session.zone()));
    }

    // ---- rows (no undo entries) ----

    public ScheduleRow addExtraRow(ScheduleSession session) {
        ScheduleSnapshot snap = session.snapshot();
        String id = "EX-" + System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(1000);
        String slot = String.valueOf(snap.getPrimeRows().size() + snap.getExtraRows().size() + 1);
        ScheduleRow row = new ScheduleRow(id, null, slot, null, null, "");
        snap.getExtraRows().add(row);
        return row;
    }

    public boolean removeExtraRow(ScheduleSession session, String rowId) {
        ScheduleSnapshot snap = session.snapshot();
        boolean removed = snap.getExtraRows().removeIf(r -> r.getRowId().equals(rowId));
        if (removed) snap.forgetRow(rowId);
        return removed;
    }

    /** Reassigns a row's auditorium; the row's manual shows follow. */
    public Optional<ScheduleRow> setRowAuditorium(ScheduleSession session, String rowId, Integer audId) {
        Optional<ScheduleRow> row = session.snapshot().findRow(rowId);
        row.ifPresent(r -> {
            r.setAudId(audId);
            String name = session.catalog().auditoriumById(audId).map(Auditorium::getName).orElse("");
            manualShowsOf(session, rowId).forEach(ms -> {
                ms.setAudId(audId);
                ms.setAudName(name);
            });
        });
        return row;
    }

    /** Reassigns a row's film; manual shows follow, or lose their film when it is unknown. */
    public Optional<ScheduleRow> setRowFilm(ScheduleSession session, String rowId, String filmId) {
        Optional<ScheduleRow> row = session.snapshot().findRow(rowId);
        row.ifPresent(r -> {
            String target = filmId == null || filmId.isBlank() ? null : filmId;
            r.setFilmId(target);
            Optional<Film> film = session.catalog().filmById(target);
            manualShowsOf(session, rowId).forEach(ms -> {
                if (film.isPresent()) {
                    ms.assignFilm(film.get());
                } else {
                    ms.clearFilm();
                }
            });
        });
        return row;
    }

    /** Sets the prime time ("HH:MM", or blank to stop generating); malformed values are ignored. */
    public Optional<ScheduleRow> setRowPrime(ScheduleSession session, String rowId, String primeHM) {
        Optional<ScheduleRow> row = session.snapshot().findRow(rowId);
        if (row.isEmpty() || primeHM == null) return row;
        if (primeHM.isBlank()) {
            row.get().setPrimeHM("");
        } else {
            TimeUtils.parseHM(primeHM).ifPresent(t -> row.get().setPrimeHM(TimeUtils.formatHM(t)));
        }
        return row;
    }

    /** Rebuilds the prime rows from bookings, keeping each booking's auditorium and prime time. */
    public void syncPrimeRows(ScheduleSession session, List<Booking> bookings) {
        ScheduleSnapshot snap = session.snapshot();
        Map<String, ScheduleRow> existing = snap.getPrimeRows().stream()
                .filter(r -> r.getBookingId() != null)
                .collect(Collectors.toMap(ScheduleRow::getBookingId, Function.identity(), (a, b) -> a));
        List<ScheduleRow> rows = new ArrayList<>();
        for (Booking b : bookings) {
            Optional<Film> film = session.catalog().filmById(b.getFilmId());
            if (film.isEmpty() || film.get().getTitle() == null || film.get().getTitle().isBlank()) continue;
            ScheduleRow old = existing.get(b.getId());
            rows.add(new ScheduleRow(
                    old != null ? old.getRowId() : "PRB-" + b.getId(),
                    b.getId(),
                    b.getSlot(),
                    b.getFilmId(),
                    old != null ? old.getAudId() : null,
                    old != null && old.getPrimeHM() != null ? old.getPrimeHM() : ""));
        }
        snap.setPrimeRows(rows);
    }

    /** Blanks every prime time and drops overrides, manual and hidden shows and the undo history. */
    public void clearAllTimes(ScheduleSession session) {
        ScheduleSnapshot snap = session.snapshot();
        snap.allRows().forEach(r -> r.setPrimeHM(""));
        snap.getOverrides().clear();
        snap.getManualShows().clear();
        snap.getHiddenShows().clear();
        snap.getUndoStack().clear();
    }

    private static List<ManualShow> manualShowsOf(ScheduleSession session, String rowId) {
        return session.snapshot().getManualShows().stream()
                .filter(ms -> rowId.equals(ms.getRowId()))
                .toList();
    }
}
