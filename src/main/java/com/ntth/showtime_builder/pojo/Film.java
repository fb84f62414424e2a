package com.ntth.showtime_builder.pojo;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ntth.showtime_builder.util.TimeUtils;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "films")
public class Film {
    @Id
    private String id;

    @NotBlank(message = "Title cannot be blank")
    private String title;

    private String rating;

    @PositiveOrZero(message = "Runtime must be non-negative")
    private Integer runtimeMin;

    @PositiveOrZero(message = "Trailer time must be non-negative")
    private Integer trailerMin;

    @PositiveOrZero(message = "Clean time must be non-negative")
    private Integer cleanMin;

    private Double priority;   // empty = no priority
    private String format;     // appended to the display title, e.g. "3D"

    public Film() {}

    public Film(String id, String title, String rating, int runtimeMin, int trailerMin, int cleanMin,
                Double priority, String format) {
        this.id = id;
        this.title = title;
        this.rating = rating;
        this.runtimeMin = runtimeMin;
        this.trailerMin = trailerMin;
        this.cleanMin = cleanMin;
        this.priority = priority;
        this.format = format;
    }

    /** Title with the format suffix, e.g. "Galaxy Kids 3D". */
    public String displayTitle() {
        String t = title == null ? "" : title;
        return format == null || format.isEmpty() ? t : t + " " + format;
    }

    /** Runtime plus trailers: the part of the cycle shown as the end time. */
    public int showMinutes() {
        return nz(runtimeMin) + nz(trailerMin);
    }

    @Transient
    @JsonProperty(value = "cycleMinutes", access = JsonProperty.Access.READ_ONLY)
    public int cycleMinutes() {
        return TimeUtils.roundUpTo5(nz(runtimeMin) + nz(trailerMin) + nz(cleanMin));
    }

    private static int nz(Integer v) {
        return v == null ? 0 : v;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getRating() { return rating; }
    public void setRating(String rating) { this.rating = rating; }

    public Integer getRuntimeMin() { return runtimeMin; }
    public void setRuntimeMin(Integer runtimeMin) { this.runtimeMin = runtimeMin; }

    public Integer getTrailerMin() { return trailerMin; }
    public void setTrailerMin(Integer trailerMin) { this.trailerMin = trailerMin; }

    public Integer getCleanMin() { return cleanMin; }
    public void setCleanMin(Integer cleanMin) { this.cleanMin = cleanMin; }

    public Double getPriority() { return priority; }
    public void setPriority(Double priority) { this.priority = priority; }

    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }
}
