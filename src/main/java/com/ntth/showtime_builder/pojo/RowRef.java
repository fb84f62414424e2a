package com.ntth.showtime_builder.pojo;

/** Grouping key of a resolved show: its generator row, or a virtual row for redirected shows. */
public sealed interface RowRef {

    String key();

    record Static(String rowId) implements RowRef {
        @Override
        public String key() {
            return rowId;
        }
    }

    /** Every show an override sends to the same auditorium and film lands in one virtual row. */
    record Dynamic(Integer audId, String filmId) implements RowRef {
        @Override
        public String key() {
            return "OV-" + audId + "-" + filmId;
        }
    }
}
