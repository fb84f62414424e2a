package com.ntth.showtime_builder.pojo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One generator line of the day's grid. Prime rows are derived from bookings
 * ({@code PRB-<bookingId>}), extra rows are added by the operator ({@code EX-...}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRow {
    private String rowId;
    private String bookingId;
    private String slot;
    private String filmId;
    private Integer audId;
    private String primeHM = "";

    public ScheduleRow copy() {
        return new ScheduleRow(rowId, bookingId, slot, filmId, audId, primeHM);
    }
}
