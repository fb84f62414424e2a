package com.ntth.showtime_builder.pojo;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/** One reversible step on the active date's undo stack. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UndoEntry.Edit.class, name = "edit"),
        @JsonSubTypes.Type(value = UndoEntry.Hide.class, name = "hide"),
        @JsonSubTypes.Type(value = UndoEntry.ManualInsert.class, name = "manual"),
        @JsonSubTypes.Type(value = UndoEntry.MoveAuditorium.class, name = "moveAud"),
        @JsonSubTypes.Type(value = UndoEntry.EditFilm.class, name = "editFilm")
})
public sealed interface UndoEntry {

    String showId();

    record Edit(String showId, Instant previousStart) implements UndoEntry {}

    record Hide(String showId, boolean previousHidden) implements UndoEntry {}

    record ManualInsert(ManualShow show) implements UndoEntry {
        @Override
        public String showId() {
            return show.getId();
        }
    }

    record MoveAuditorium(String showId, Integer previousAudId) implements UndoEntry {}

    record EditFilm(String showId, String previousFilmId) implements UndoEntry {}
}
