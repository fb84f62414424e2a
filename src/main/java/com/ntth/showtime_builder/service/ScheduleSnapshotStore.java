package com.ntth.showtime_builder.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ntth.showtime_builder.Config.ShowtimeProperties;
import com.ntth.showtime_builder.pojo.OperatingWindow;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;
import com.ntth.showtime_builder.repository.KeyValueStore;
import com.ntth.showtime_builder.util.TimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Keeps one {@link ScheduleSnapshot} per calendar date plus the working copy of the
 * active date. Persistence is best effort: a failed save is logged and the
 * in-memory state stays authoritative.
 */
@Component
public class ScheduleSnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(ScheduleSnapshotStore.class);

    static final String KEY_SCHEDULES = "schedulesByDate";
    static final String KEY_CURRENT_DATE = "currentDate";
    static final String KEY_WINDOW = "operatingWindow";
    static final String KEY_LEGACY_SCHEDULE = "schedule";

    private static final TypeReference<TreeMap<String, ScheduleSnapshot>> SCHEDULES_TYPE = new TypeReference<>() {};

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final ApplicationEventPublisher events;
    private final ShowtimeProperties props;

    // ISO date -> snapshot; ISO order is chronological
    private TreeMap<String, ScheduleSnapshot> schedulesByDate = new TreeMap<>();
    private LocalDate currentDate;
    private ScheduleSnapshot active = new ScheduleSnapshot();
    private OperatingWindow window;

    public ScheduleSnapshotStore(KeyValueStore store, ObjectMapper mapper,
                                 ApplicationEventPublisher events, ShowtimeProperties props) {
        this.store = store;
        this.mapper = mapper;
        this.events = events;
        this.props = props;
    }

    /**
     * Loads the persisted state. A single-date schedule saved under the legacy key
     * becomes the snapshot of the current date when that date has none yet.
     */
    public void initialize() {
        schedulesByDate = read(KEY_SCHEDULES, SCHEDULES_TYPE).orElseGet(TreeMap::new);
        currentDate = read(KEY_CURRENT_DATE, new TypeReference<String>() {})
                .flatMap(TimeUtils::parseDate)
                .orElseGet(() -> LocalDate.now(zone()));
        window = read(KEY_WINDOW, new TypeReference<OperatingWindow>() {})
                .orElseGet(() -> new OperatingWindow(props.getFirstShow(), props.getLastShow()));

        String key = currentDate.toString();
        boolean migrated = false;
        if (!schedulesByDate.containsKey(key)) {
            Optional<ScheduleSnapshot> legacy = read(KEY_LEGACY_SCHEDULE, new TypeReference<ScheduleSnapshot>() {});
            legacy.ifPresent(s -> log.info("Migrating single-date schedule into {}", key));
            migrated = legacy.isPresent();
            schedulesByDate.put(key, legacy.orElseGet(ScheduleSnapshot::new));
        }
        active = schedulesByDate.get(key).deepCopy();
        save();
        if (migrated && read(KEY_SCHEDULES, SCHEDULES_TYPE).isPresent()) discard(KEY_LEGACY_SCHEDULE);
        log.info("Schedule store ready: current date {}, {} stored dates", currentDate, schedulesByDate.size());
    }

    public LocalDate currentDate() {
        ready();
        return currentDate;
    }

    public ScheduleSnapshot active() {
        ready();
        return active;
    }

    public OperatingWindow window() {
        ready();
        return window;
    }

    public void setWindow(OperatingWindow window) {
        ready();
        this.window = window;
        write(KEY_WINDOW, window);
    }

    /** Stores the working copy under the current date, prunes old dates and persists. */
    public void save() {
        ready();
        schedulesByDate.put(currentDate.toString(), active.deepCopy());
        prune();
        persist();
    }

    public void switchTo(LocalDate date) {
        ready();
        if (date == null) return;
        LocalDate previous = currentDate;
        schedulesByDate.put(currentDate.toString(), active.deepCopy());
        currentDate = date;
        active = schedulesByDate.computeIfAbsent(date.toString(), k -> new ScheduleSnapshot()).deepCopy();
        save();
        log.info("Switched schedule date {} -> {}", previous, date);
        events.publishEvent(new ScheduleDateChangedEvent(previous, date));
    }

    /**
     * Copies the schedule of {@code from} onto each target date, moving times to the
     * target day. Targets are overwritten and start with an empty undo history.
     *
     * @return number of dates written
     */
    public int copy(LocalDate from, Collection<LocalDate> targets) {
        ready();
        LocalDate source = from == null ? currentDate : from;
        if (targets == null || targets.isEmpty()) return 0;
        schedulesByDate.put(currentDate.toString(), active.deepCopy());
        ScheduleSnapshot src = schedulesByDate.get(source.toString());
        if (src == null) return 0;

        ZoneId zone = zone();
        int written = 0;
        for (LocalDate target : targets) {
            if (target == null || target.equals(source)) continue;
            long days = ChronoUnit.DAYS.between(source, target);
            schedulesByDate.put(target.toString(),
                    src.copyWithoutUndo(t -> t.atZone(zone).plusDays(days).toInstant()));
            if (target.equals(currentDate)) {
                active = schedulesByDate.get(target.toString()).deepCopy();
            }
            written++;
        }
        prune();
        persist();
        log.info("Copied schedule {} to {} date(s)", source, written);
        return written;
    }

    public void clear(LocalDate date) {
        ready();
        LocalDate target = date == null ? currentDate : date;
        schedulesByDate.put(target.toString(), new ScheduleSnapshot());
        if (target.equals(currentDate)) {
            active = new ScheduleSnapshot();
        }
        persist();
        log.info("Cleared schedule of {}", target);
    }

    public void clearAll() {
        ready();
        schedulesByDate.replaceAll((k, v) -> new ScheduleSnapshot());
        active = new ScheduleSnapshot();
        save();
        log.info("Cleared all {} stored schedules", schedulesByDate.size());
    }

    public List<String> listDates() {
        ready();
        List<String> dates = new ArrayList<>(schedulesByDate.keySet());
        if (!dates.contains(currentDate.toString())) {
            dates.add(currentDate.toString());
            dates.sort(null);
        }
        return dates;
    }

    /** Copy targets offered around a date: three days before and ten after. */
    public List<LocalDate> nearbyDates(LocalDate date) {
        List<LocalDate> out = new ArrayList<>();
        for (int i = -3; i <= 10; i++) {
            if (i != 0) out.add(date.plusDays(i));
        }
        return out;
    }

    /** Applies {@code change} to every stored snapshot and to the working copy, then persists. */
    public void updateAll(Consumer<ScheduleSnapshot> change) {
        ready();
        schedulesByDate.forEach((date, snap) -> {
            if (!date.equals(currentDate.toString())) change.accept(snap);
        });
        change.accept(active);
        save();
    }

    /** True when the working copy or any other stored date matches. */
    public boolean anyMatch(Predicate<ScheduleSnapshot> test) {
        ready();
        if (test.test(active)) return true;
        return schedulesByDate.entrySet().stream()
                .filter(e -> !e.getKey().equals(currentDate.toString()))
                .anyMatch(e -> test.test(e.getValue()));
    }

    private void ready() {
        if (currentDate == null) initialize();
    }

    private void prune() {
        int retention = Math.max(14, props.getRetentionDays());
        List<String> keys = new ArrayList<>(schedulesByDate.keySet());
        keys.remove(currentDate.toString());
        int excess = schedulesByDate.size() - retention;
        for (int i = 0; i < excess && i < keys.size(); i++) {
            schedulesByDate.remove(keys.get(i));
            log.debug("Pruned schedule of {}", keys.get(i));
        }
    }

    private void persist() {
        write(KEY_SCHEDULES, schedulesByDate);
        write(KEY_CURRENT_DATE, currentDate.toString());
    }

    private void write(String key, Object value) {
        try {
            store.save(key, mapper.writeValueAsString(value));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Could not persist '{}': {}", key, e.getMessage());
        }
    }

    private void discard(String key) {
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.warn("Could not remove '{}': {}", key, e.getMessage());
        }
    }

    private <T> Optional<T> read(String key, TypeReference<T> type) {
        try {
            Optional<String> json = store.load(key);
            if (json.isEmpty()) return Optional.empty();
            return Optional.ofNullable(mapper.readValue(json.get(), type));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Ignoring unreadable '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private ZoneId zone() {
        return props.zoneId();
    }
}
