package com.ntth.showtime_builder.pojo;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/** Everything that belongs to one calendar date of the schedule. */
@Data
public class ScheduleSnapshot {
    private List<ScheduleRow> primeRows = new ArrayList<>();
    private List<ScheduleRow> extraRows = new ArrayList<>();
    private List<ManualShow> manualShows = new ArrayList<>();
    private Map<String, ShowOverride> overrides = new LinkedHashMap<>();
    private Set<String> hiddenShows = new LinkedHashSet<>();
    private List<UndoEntry> undoStack = new ArrayList<>();

    public List<ScheduleRow> allRows() {
        List<ScheduleRow> rows = new ArrayList<>(primeRows);
        rows.addAll(extraRows);
        return rows;
    }

    public Optional<ScheduleRow> findRow(String rowId) {
        return allRows().stream().filter(r -> r.getRowId().equals(rowId)).findFirst();
    }

    public Optional<ManualShow> findManualShow(String showId) {
        return manualShows.stream().filter(m -> m.getId().equals(showId)).findFirst();
    }

    public Optional<ShowOverride> overrideFor(String showId) {
        return Optional.ofNullable(overrides.get(showId));
    }

    /** Applies {@code patch} to the show's override; an override left empty is dropped. */
    public void patchOverride(String showId, UnaryOperator<ShowOverride> patch) {
        ShowOverride next = patch.apply(overrides.getOrDefault(showId, ShowOverride.EMPTY));
        if (next.isEmpty()) {
            overrides.remove(showId);
        } else {
            overrides.put(showId, next);
        }
    }

    public void pushUndo(UndoEntry entry) {
        undoStack.add(entry);
    }

    public Optional<UndoEntry> popUndo() {
        if (undoStack.isEmpty()) return Optional.empty();
        return Optional.of(undoStack.remove(undoStack.size() - 1));
    }

    /** Drops a row's manual shows and every override keyed {@code rowId:offset}. */
    public void forgetRow(String rowId) {
        manualShows.removeIf(m -> rowId.equals(m.getRowId()));
        overrides.keySet().removeIf(k -> k.startsWith(rowId + ":"));
    }

    public ScheduleSnapshot deepCopy() {
        ScheduleSnapshot c = copyWithoutUndo(UnaryOperator.identity());
        c.undoStack = new ArrayList<>(undoStack);
        return c;
    }

    /**
     * Copy for another date: instants are moved with {@code shift}, the undo history
     * stays behind.
     */
    public ScheduleSnapshot copyWithoutUndo(UnaryOperator<Instant> shift) {
        ScheduleSnapshot c = new ScheduleSnapshot();
        primeRows.forEach(r -> c.primeRows.add(r.copy()));
        extraRows.forEach(r -> c.extraRows.add(r.copy()));
        for (ManualShow m : manualShows) {
            ManualShow copy = new ManualShow(m);
            if (copy.getStart() != null) copy.setStart(shift.apply(copy.getStart()));
            if (copy.getEnd() != null) copy.setEnd(shift.apply(copy.getEnd()));
            c.manualShows.add(copy);
        }
        overrides.forEach((id, ov) -> c.overrides.put(id,
                ov.start() == null ? ov : ov.withStart(shift.apply(ov.start()))));
        c.hiddenShows.addAll(hiddenShows);
        return c;
    }
}
