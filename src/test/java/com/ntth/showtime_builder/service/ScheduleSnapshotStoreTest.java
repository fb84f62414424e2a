package com.ntth.showtime_builder.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ntth.showtime_builder.Config.ShowtimeProperties;
import com.ntth.showtime_builder.pojo.ManualShow;
import com.ntth.showtime_builder.pojo.OperatingWindow;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;
import com.ntth.showtime_builder.pojo.ShowOverride;
import com.ntth.showtime_builder.pojo.UndoEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;

import static com.ntth.showtime_builder.service.EngineFixtures.DAY;
import static com.ntth.showtime_builder.service.EngineFixtures.at;
import static com.ntth.showtime_builder.service.EngineFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ScheduleSnapshotStoreTest {

    private InMemoryKeyValueStore kv;
    private ObjectMapper mapper;
    private ApplicationEventPublisher events;
    private ShowtimeProperties props;

    @BeforeEach
    void setUp() throws Exception {
        kv = new InMemoryKeyValueStore();
        mapper = new ObjectMapper().registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        events = mock(ApplicationEventPublisher.class);
        props = new ShowtimeProperties();
        props.setZone("UTC");
        kv.data.put(ScheduleSnapshotStore.KEY_CURRENT_DATE, mapper.writeValueAsString(DAY.toString()));
    }

    private ScheduleSnapshotStore newStore() {
        return new ScheduleSnapshotStore(kv, mapper, events, props);
    }

    @Test
    void initialize_migratesLegacySchedule() throws Exception {
        ScheduleSnapshot legacy = new ScheduleSnapshot();
        legacy.getPrimeRows().add(row("R1", "F1", 1, "19:00"));
        kv.data.put(ScheduleSnapshotStore.KEY_LEGACY_SCHEDULE, mapper.writeValueAsString(legacy));

        ScheduleSnapshotStore store = newStore();

        assertThat(store.currentDate()).isEqualTo(DAY);
        assertThat(store.active().getPrimeRows()).extracting(r -> r.getRowId()).containsExactly("R1");
        assertThat(store.window()).isEqualTo(new OperatingWindow("07:00", "23:00"));
        assertThat(kv.data).containsKey(ScheduleSnapshotStore.KEY_SCHEDULES);
        assertThat(kv.data).doesNotContainKey(ScheduleSnapshotStore.KEY_LEGACY_SCHEDULE);
    }

    @Test
    void stateSurvivesRestart_includingUndoHistory() {
        ScheduleSnapshotStore store = newStore();
        ScheduleSnapshot snap = store.active();
        snap.getPrimeRows().add(row("R1", "F1", 1, "19:00"));
        snap.getOverrides().put("R1:0", new ShowOverride(at(19, 20), 2, null));
        snap.getHiddenShows().add("R1:1");
        snap.pushUndo(new UndoEntry.Edit("R1:0", at(19, 0)));
        snap.pushUndo(new UndoEntry.Hide("R1:1", false));
        store.save();

        ScheduleSnapshot restored = newStore().active();

        assertThat(restored.getOverrides()).containsEntry("R1:0", new ShowOverride(at(19, 20), 2, null));
        assertThat(restored.getHiddenShows()).containsExactly("R1:1");
        assertThat(restored.getUndoStack()).containsExactly(
                new UndoEntry.Edit("R1:0", at(19, 0)), new UndoEntry.Hide("R1:1", false));
    }

    @Test
    void switchTo_keepsEachDateAndPublishesEvent() {
        ScheduleSnapshotStore store = newStore();
        store.active().getPrimeRows().add(row("R1", "F1", 1, "19:00"));
        LocalDate next = DAY.plusDays(1);

        store.switchTo(next);

        assertThat(store.currentDate()).isEqualTo(next);
        assertThat(store.active().getPrimeRows()).isEmpty();
        verify(events).publishEvent(new ScheduleDateChangedEvent(DAY, next));

        store.switchTo(DAY);
        assertThat(store.active().getPrimeRows()).hasSize(1);
        assertThat(store.listDates()).containsExactly(DAY.toString(), next.toString());
    }

    @Test
    void copy_shiftsTimesAndDropsUndo() {
        ScheduleSnapshotStore store = newStore();
        ScheduleSnapshot snap = store.active();
        ManualShow manual = new ManualShow();
        manual.setId("M-1");
        manual.setRowId("R1");
        manual.setStart(at(12, 0));
        manual.setEnd(at(14, 15));
        snap.getManualShows().add(manual);
        snap.getPrimeRows().add(row("R1", "F1", 1, "19:00"));
        snap.getHiddenShows().add("R1:2");
        snap.getOverrides().put("R1:0", new ShowOverride(at(19, 20), null, null));
        snap.pushUndo(new UndoEntry.Edit("R1:0", at(19, 0)));

        int written = store.copy(DAY, List.of(DAY.plusDays(2), DAY));
        store.switchTo(DAY.plusDays(2));

        assertThat(written).isEqualTo(1);
        ScheduleSnapshot copied = store.active();
        assertThat(copied.getUndoStack()).isEmpty();
        assertThat(copied.getManualShows().get(0).getStart()).isEqualTo(at(12, 0).plusSeconds(2 * 86400));
        assertThat(copied.getOverrides().get("R1:0").start()).isEqualTo(at(19, 20).plusSeconds(2 * 86400));
        assertThat(copied.getPrimeRows()).singleElement().satisfies(r -> {
            assertThat(r.getRowId()).isEqualTo("R1");
            assertThat(r.getFilmId()).isEqualTo("F1");
            assertThat(r.getAudId()).isEqualTo(1);
            assertThat(r.getPrimeHM()).isEqualTo("19:00");
        });
        assertThat(copied.getHiddenShows()).containsExactly("R1:2");
    }

    @Test
    void copy_ontoActiveDate_reloadsWorkingCopy() {
        ScheduleSnapshotStore store = newStore();
        store.switchTo(DAY.plusDays(1));
        store.active().getPrimeRows().add(row("R9", "F2", 2, "18:00"));
        store.switchTo(DAY);
        assertThat(store.active().getPrimeRows()).isEmpty();

        store.copy(DAY.plusDays(1), List.of(DAY));

        assertThat(store.active().getPrimeRows()).extracting(r -> r.getRowId()).containsExactly("R9");
    }

    @Test
    void save_prunesOldestDatesButKeepsCurrent() {
        ScheduleSnapshotStore store = newStore();
        IntStream.rangeClosed(1, 20).forEach(i -> store.copy(DAY, List.of(DAY.minusDays(i))));

        List<String> dates = store.listDates();

        assertThat(dates).hasSize(14).contains(DAY.toString()).doesNotContain(DAY.minusDays(20).toString());
    }

    @Test
    void clear_emptiesOneDate() {
        ScheduleSnapshotStore store = newStore();
        store.active().getPrimeRows().add(row("R1", "F1", 1, "19:00"));
        store.save();

        store.clear(DAY);

        assertThat(store.active().getPrimeRows()).isEmpty();
        assertThat(store.listDates()).contains(DAY.toString());
    }

    @Test
    void failedWrites_keepInMemoryState() {
        ScheduleSnapshotStore store = newStore();
        store.currentDate();
        kv.failWrites = true;

        store.active().getPrimeRows().add(row("R1", "F1", 1, "19:00"));
        store.save();
        store.setWindow(new OperatingWindow("09:00", "01:00"));

        assertThat(store.active().getPrimeRows()).hasSize(1);
        assertThat(store.window().lastHM()).isEqualTo("01:00");
    }

    @Test
    void unreadableState_startsFresh() {
        kv.data.put(ScheduleSnapshotStore.KEY_SCHEDULES, "{not json");

        ScheduleSnapshotStore store = newStore();

        assertThat(store.active().allRows()).isEmpty();
        assertThat(store.currentDate()).isEqualTo(DAY);
    }
}
