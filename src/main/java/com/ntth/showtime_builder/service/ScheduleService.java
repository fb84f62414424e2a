package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.Config.ShowtimeProperties;
import com.ntth.showtime_builder.pojo.Booking;
import com.ntth.showtime_builder.pojo.Catalog;
import com.ntth.showtime_builder.pojo.OperatingWindow;
import com.ntth.showtime_builder.pojo.ScheduleRow;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.pojo.UndoEntry;
import com.ntth.showtime_builder.repository.AuditoriumRepository;
import com.ntth.showtime_builder.repository.FilmRepository;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * The single scheduling session of the application. Every public method is
 * synchronized so that concurrent requests see one writer at a time; each
 * mutation is saved through {@link ScheduleSnapshotStore} before returning.
 */
@Service
public class ScheduleService {

    private final ScheduleSnapshotStore store;
    private final ShowResolver resolver;
    private final ShowEditor editor;
    private final UndoEngine undoEngine;
    private final ScheduleAuditor auditor;
    private final AuditoriumRepository auditoriumRepository;
    private final FilmRepository filmRepository;
    private final ShowtimeProperties props;

    public ScheduleService(ScheduleSnapshotStore store, ShowResolver resolver, ShowEditor editor,
                           UndoEngine undoEngine, ScheduleAuditor auditor,
                           AuditoriumRepository auditoriumRepository, FilmRepository filmRepository,
                           ShowtimeProperties props) {
        this.store = store;
        this.resolver = resolver;
        this.editor = editor;
        this.undoEngine = undoEngine;
        this.auditor = auditor;
        this.auditoriumRepository = auditoriumRepository;
        this.filmRepository = filmRepository;
        this.props = props;
    }

    private ScheduleSession session() {
        Catalog catalog = new Catalog(auditoriumRepository.findAll(), filmRepository.findAll());
        return new ScheduleSession(store.currentDate(), props.zoneId(), store.window(), catalog, store.active());
    }

    // ---- shows ----

    public synchronized List<Show> shows() {
        return resolver.resolve(session());
    }

    public synchronized List<Show> setStart(String showId, String hm) {
        return mutate(s -> editor.setStart(s, showId, hm));
    }

    public synchronized List<Show> setAuditorium(String showId, Integer audId) {
        return mutate(s -> editor.setAuditorium(s, showId, audId));
    }

    public synchronized List<Show> setFilm(String showId, String filmId) {
        return mutate(s -> editor.setFilm(s, showId, filmId));
    }

    public synchronized List<Show> addManualShow(String rowId, String hm) {
        return mutate(s -> editor.addManualShow(s, rowId, hm));
    }

    public synchronized List<Show> nudge(String showId, int direction) {
        return mutate(s -> editor.nudge(s, showId, direction));
    }

    public synchronized List<Show> undo() {
        ScheduleSession s = session();
        Optional<UndoEntry> undone = undoEngine.undo(s);
        if (undone.isPresent()) store.save();
        return resolver.resolve(s);
    }

    public synchronized List<String> startOptions(String showId) {
        return editor.startOptions(session(), showId);
    }

    private List<Show> mutate(Consumer<ScheduleSession> change) {
        ScheduleSession s = session();
        change.accept(s);
        store.save();
        return resolver.resolve(s);
    }

    // ---- rows ----

    /** Prime and extra rows by numeric slot; non-numeric slots sort after, by text. */
    public synchronized List<ScheduleRow> rows() {
        return store.active().allRows().stream()
                .sorted(Comparator.comparing((ScheduleRow r) -> slotNumber(r.getSlot()))
                        .thenComparing(r -> r.getSlot() == null ? "" : r.getSlot()))
                .toList();
    }

    public synchronized ScheduleRow addExtraRow() {
        ScheduleRow row = editor.addExtraRow(session());
        store.save();
        return row;
    }

    public synchronized boolean removeExtraRow(String rowId) {
        boolean removed = editor.removeExtraRow(session(), rowId);
        if (removed) store.save();
        return removed;
    }

    public synchronized Optional<ScheduleRow> setRowAuditorium(String rowId, Integer audId) {
        return saveRow(editor.setRowAuditorium(session(), rowId, audId));
    }

    public synchronized Optional<ScheduleRow> setRowFilm(String rowId, String filmId) {
        return saveRow(editor.setRowFilm(session(), rowId, filmId));
    }

    public synchronized Optional<ScheduleRow> setRowPrime(String rowId, String primeHM) {
        return saveRow(editor.setRowPrime(session(), rowId, primeHM));
    }

    private Optional<ScheduleRow> saveRow(Optional<ScheduleRow> row) {
        if (row.isPresent()) store.save();
        return row;
    }

    public synchronized void syncPrimeRows(List<Booking> bookings) {
        editor.syncPrimeRows(session(), bookings);
        store.save();
    }

    public synchronized void clearAllTimes() {
        editor.clearAllTimes(session());
        store.save();
    }

    // ---- dates ----

    public synchronized LocalDate currentDate() {
        return store.currentDate();
    }

    public synchronized void switchDate(LocalDate date) {
        store.switchTo(date);
    }

    public synchronized int copySchedule(LocalDate from, Collection<LocalDate> targets) {
        return store.copy(from, targets);
    }

    public synchronized void clearSchedule(LocalDate date) {
        store.clear(date);
    }

    public synchronized void clearAllSchedules() {
        store.clearAll();
    }

    public synchronized List<String> listDates() {
        return store.listDates();
    }

    public synchronized List<LocalDate> nearbyDates(LocalDate date) {
        return store.nearbyDates(date == null ? store.currentDate() : date);
    }

    public synchronized OperatingWindow window() {
        return store.window();
    }

    public synchronized OperatingWindow setWindow(OperatingWindow window) {
        store.setWindow(window);
        return store.window();
    }

    /** Runs {@code change} on the snapshot of every stored date. */
    public synchronized void updateAllSnapshots(Consumer<ScheduleSnapshot> change) {
        store.updateAll(change);
    }

    public synchronized boolean anySnapshot(Predicate<ScheduleSnapshot> test) {
        return store.anyMatch(test);
    }

    // ---- reports ----

    public synchronized List<DowntimeAnalyzer.Issue> issues() {
        ScheduleSession s = session();
        return auditor.issues(s, resolver.resolve(s));
    }

    public synchronized ScheduleAuditor.FlaggedCounts flaggedCounts() {
        ScheduleSession s = session();
        return auditor.flaggedCounts(auditor.issues(s, resolver.resolve(s)));
    }

    public synchronized ScheduleAuditor.AuditReport audit() {
        ScheduleSession s = session();
        return auditor.audit(s, resolver.resolve(s));
    }

    public synchronized List<ScheduleAuditor.OrderLine> startTimeOrder() {
        ScheduleSession s = session();
        return auditor.startTimeOrder(s, resolver.resolve(s));
    }

    private static int slotNumber(String slot) {
        if (slot == null) return Integer.MAX_VALUE;
        try {
            return Integer.parseInt(slot.trim());
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
