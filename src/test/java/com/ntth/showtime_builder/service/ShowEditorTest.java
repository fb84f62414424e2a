package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Booking;
import com.ntth.showtime_builder.pojo.ScheduleRow;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.pojo.ShowOverride;
import com.ntth.showtime_builder.pojo.ShowSource;
import com.ntth.showtime_builder.pojo.UndoEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.ntth.showtime_builder.service.EngineFixtures.at;
import static com.ntth.showtime_builder.service.EngineFixtures.nextDayAt;
import static com.ntth.showtime_builder.service.EngineFixtures.row;
import static com.ntth.showtime_builder.service.EngineFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ShowEditorTest {

    private ShowResolver resolver;
    private ShowEditor editor;
    private ScheduleSession session;

    @BeforeEach
    void setUp() {
        resolver = new ShowResolver(new CycleGenerator());
        editor = new ShowEditor(resolver);
        session = session(row("R1", "F1", 1, "19:00"));
    }

    @Test
    void setStart_movesShowAndRecordsOneEdit() {
        Optional<Show> moved = editor.setStart(session, "R1:0", "19:20");

        assertThat(moved).get().extracting(Show::start).isEqualTo(at(19, 20));
        assertThat(session.snapshot().getOverrides()).containsKey("R1:0");
        assertThat(session.snapshot().getUndoStack())
                .containsExactly(new UndoEntry.Edit("R1:0", at(19, 0)));
    }

    @Test
    void setStart_beforeRollover_landsOnNextDay() {
        Optional<Show> moved = editor.setStart(session, "R1:1", "00:30");

        assertThat(moved).get().extracting(Show::start).isEqualTo(nextDayAt(0, 30));
    }

    @Test
    void setStart_sameTime_isNoOp() {
        editor.setStart(session, "R1:0", "19:00");

        assertThat(session.snapshot().getOverrides()).isEmpty();
        assertThat(session.snapshot().getUndoStack()).isEmpty();
    }

    @Test
    void setStart_malformed_isIgnored() {
        Optional<Show> result = editor.setStart(session, "R1:0", "7pm");

        assertThat(result).get().extracting(Show::start).isEqualTo(at(19, 0));
        assertThat(session.snapshot().getUndoStack()).isEmpty();
    }

    @Test
    void setStart_blank_hidesShow() {
        Optional<Show> result = editor.setStart(session, "R1:0", " ");

        assertThat(result).isEmpty();
        assertThat(session.snapshot().getHiddenShows()).containsExactly("R1:0");
        assertThat(resolver.resolve(session)).extracting(Show::id).doesNotContain("R1:0");
        assertThat(session.snapshot().getUndoStack()).containsExactly(new UndoEntry.Hide("R1:0", false));
    }

    @Test
    void setStart_unknownShow_changesNothing() {
        assertThat(editor.setStart(session, "nope:0", "10:00")).isEmpty();
        assertThat(session.snapshot().getUndoStack()).isEmpty();
    }

    @Test
    void setAuditorium_unknownId_isNoOp() {
        editor.setAuditorium(session, "R1:0", 99);

        assertThat(session.snapshot().getOverrides()).isEmpty();
        assertThat(session.snapshot().getUndoStack()).isEmpty();
    }

    @Test
    void setAuditorium_null_clearsOverride() {
        editor.setAuditorium(session, "R1:0", 2);
        Optional<Show> cleared = editor.setAuditorium(session, "R1:0", null);

        assertThat(cleared).get().extracting(Show::audId).isEqualTo(1);
        assertThat(session.snapshot().getOverrides()).isEmpty();
        assertThat(session.snapshot().getUndoStack()).hasSize(2);
    }

    @Test
    void setFilm_onGeneratedShow_writesOverride() {
        Optional<Show> show = editor.setFilm(session, "R1:0", "F2");

        assertThat(show).get().satisfies(s -> {
            assertThat(s.filmId()).isEqualTo("F2");
            assertThat(s.source()).isEqualTo(ShowSource.OVERRIDE);
        });
        assertThat(session.snapshot().getOverrides().get("R1:0")).isEqualTo(new ShowOverride(null, null, "F2"));
    }

    @Test
    void addManualShow_usesRowFilmAndAuditorium() {
        Optional<Show> show = editor.addManualShow(session, "R1", "23:45");

        assertThat(show).get().satisfies(s -> {
            assertThat(s.id()).startsWith("M-");
            assertThat(s.source()).isEqualTo(ShowSource.MANUAL);
            assertThat(s.audId()).isEqualTo(1);
            assertThat(s.filmId()).isEqualTo("F1");
            assertThat(s.end()).isEqualTo(nextDayAt(2, 0));
        });
        assertThat(session.snapshot().getUndoStack()).singleElement().isInstanceOf(UndoEntry.ManualInsert.class);
    }

    @Test
    void addManualShow_rowWithoutAuditorium_isRejected() {
        session.snapshot().getPrimeRows().get(0).setAudId(null);

        assertThat(editor.addManualShow(session, "R1", "12:00")).isEmpty();
        assertThat(session.snapshot().getManualShows()).isEmpty();
    }

    @Test
    void setAuditorium_onManualShow_editsRecord() {
        String id = editor.addManualShow(session, "R1", "12:10").orElseThrow().id();

        editor.setAuditorium(session, id, 3);

        assertThat(session.snapshot().findManualShow(id)).get().satisfies(m -> {
            assertThat(m.getAudId()).isEqualTo(3);
            assertThat(m.getAudName()).isEqualTo("Aud 3");
        });
        assertThat(session.snapshot().getOverrides()).doesNotContainKey(id);
    }

    @Test
    void startOptions_stayInsideWindow() {
        List<String> options = editor.startOptions(session, "R1:-4");   // the 09:00 show

        assertThat(options).startsWith("07:30").contains("09:00", "10:30").endsWith("10:30");
        assertThat(options).hasSize(37);
    }

    @Test
    void nudge_shiftsByFiveMinutes() {
        editor.nudge(session, "R1:0", -1);
        Optional<Show> show = editor.nudge(session, "R1:0", -1);

        assertThat(show).get().extracting(Show::start).isEqualTo(at(18, 50));
        assertThat(session.snapshot().getUndoStack()).hasSize(2);
    }

    @Test
    void removeExtraRow_dropsItsManualShowsAndOverrides() {
        ScheduleRow extra = editor.addExtraRow(session);
        editor.setRowFilm(session, extra.getRowId(), "F2");
        editor.setRowAuditorium(session, extra.getRowId(), 2);
        editor.setRowPrime(session, extra.getRowId(), "14:00");
        editor.addManualShow(session, extra.getRowId(), "22:00");
        editor.setStart(session, extra.getRowId() + ":0", "14:10");

        assertThat(editor.removeExtraRow(session, extra.getRowId())).isTrue();

        assertThat(session.snapshot().getManualShows()).isEmpty();
        assertThat(session.snapshot().getOverrides()).isEmpty();
        assertThat(resolver.resolve(session)).allMatch(s -> s.audId() == 1);
    }

    @Test
    void setRowPrime_normalizesAndIgnoresGarbage() {
        editor.setRowPrime(session, "R1", "9:5");
        assertThat(session.snapshot().findRow("R1")).get().extracting(ScheduleRow::getPrimeHM).isEqualTo("09:05");

        editor.setRowPrime(session, "R1", "soon");
        assertThat(session.snapshot().findRow("R1")).get().extracting(ScheduleRow::getPrimeHM).isEqualTo("09:05");
    }

    @Test
    void setRowFilm_toUnknown_clearsManualShowFilm() {
        String id = editor.addManualShow(session, "R1", "12:10").orElseThrow().id();

        editor.setRowFilm(session, "R1", "gone");

        assertThat(session.snapshot().findManualShow(id)).get().satisfies(m -> {
            assertThat(m.getFilmId()).isNull();
            assertThat(m.getEnd()).isEqualTo(m.getStart());
        });
    }

    @Test
    void syncPrimeRows_keepsAuditoriumAndPrimeOfExistingBookings() {
        session.snapshot().getPrimeRows().clear();
        session.snapshot().getPrimeRows().add(new ScheduleRow("PRB-B1", "B1", "1", "F1", 2, "18:00"));

        editor.syncPrimeRows(session, List.of(
                new Booking("B1", 1, "1", "F1", "", 1),
                new Booking("B2", 1, "2", "F2", "", 1),
                new Booking("B3", 1, "3", "missing", "", 1)));

        assertThat(session.snapshot().getPrimeRows())
                .extracting(ScheduleRow::getRowId, ScheduleRow::getAudId, ScheduleRow::getPrimeHM)
                .containsExactly(
                        tuple("PRB-B1", 2, "18:00"),
                        tuple("PRB-B2", null, ""));
    }

    @Test
    void clearAllTimes_wipesEdits() {
        editor.setStart(session, "R1:0", "19:10");
        editor.setStart(session, "R1:1", "");
        editor.addManualShow(session, "R1", "12:00");

        editor.clearAllTimes(session);

        assertThat(resolver.resolve(session)).isEmpty();
        assertThat(session.snapshot().getUndoStack()).isEmpty();
        assertThat(session.snapshot().getHiddenShows()).isEmpty();
        assertThat(session.snapshot().getOverrides()).isEmpty();
    }
}
