package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Auditorium;
import com.ntth.showtime_builder.pojo.ManualShow;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.pojo.UndoEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Pops the most recent undo entry and applies its inverse. Undoing never records
 * a new entry, and an empty stack is a no-op.
 */
@Component
public class UndoEngine {
    private static final Logger log = LoggerFactory.getLogger(UndoEngine.class);

    private final ShowResolver resolver;

    public UndoEngine(ShowResolver resolver) {
        this.resolver = resolver;
    }

    public Optional<UndoEntry> undo(ScheduleSession session) {
        ScheduleSnapshot snap = session.snapshot();
        Optional<UndoEntry> popped = snap.popUndo();
        popped.ifPresent(entry -> {
            revert(session, entry);
            log.debug("Undid {} on show {}", entry.getClass().getSimpleName(), entry.showId());
        });
        return popped;
    }

    private void revert(ScheduleSession session, UndoEntry entry) {
        ScheduleSnapshot snap = session.snapshot();
        if (entry instanceof UndoEntry.Edit e) {
            snap.patchOverride(e.showId(), ov -> ov.withStart(e.previousStart()));
        } else if (entry instanceof UndoEntry.Hide h) {
            if (h.previousHidden()) {
                snap.getHiddenShows().add(h.showId());
            } else {
                snap.getHiddenShows().remove(h.showId());
            }
        } else if (entry instanceof UndoEntry.ManualInsert m) {
            snap.getManualShows().removeIf(ms -> ms.getId().equals(m.showId()));
        } else if (entry instanceof UndoEntry.MoveAuditorium mv) {
            revertAuditorium(session, mv);
        } else if (entry instanceof UndoEntry.EditFilm ef) {
            revertFilm(session, ef);
        }
    }

    private void revertAuditorium(ScheduleSession session, UndoEntry.MoveAuditorium mv) {
        ScheduleSnapshot snap = session.snapshot();
        Optional<ManualShow> manual = snap.findManualShow(mv.showId());
        if (manual.isPresent()) {
            manual.get().setAudId(mv.previousAudId());
            manual.get().setAudName(session.catalog().auditoriumById(mv.previousAudId())
                    .map(Auditorium::getName).orElse(""));
            return;
        }
        Integer base = resolver.findBase(session, mv.showId()).map(Show::audId).orElse(null);
        if (mv.previousAudId() == null || Objects.equals(mv.previousAudId(), base)) {
            snap.patchOverride(mv.showId(), ov -> ov.withAudId(null));
        } else {
            snap.patchOverride(mv.showId(), ov -> ov.withAudId(mv.previousAudId()));
        }
    }

    private void revertFilm(ScheduleSession session, UndoEntry.EditFilm ef) {
        ScheduleSnapshot snap = session.snapshot();
        Optional<ManualShow> manual = snap.findManualShow(ef.showId());
        if (manual.isPresent()) {
            session.catalog().filmById(ef.previousFilmId()).ifPresent(manual.get()::assignFilm);
            return;
        }
        String base = resolver.findBase(session, ef.showId()).map(Show::filmId).orElse(null);
        if (ef.previousFilmId() == null || ef.previousFilmId().equals(base)) {
            snap.patchOverride(ef.showId(), ov -> ov.withFilmId(null));
        } else {
            snap.patchOverride(ef.showId(), ov -> ov.withFilmId(ef.previousFilmId()));
        }
    }
}
