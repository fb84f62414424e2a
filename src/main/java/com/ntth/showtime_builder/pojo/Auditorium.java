package com.ntth.showtime_builder.pojo;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "auditoriums")
public class Auditorium {
    @Id
    private Integer id;

    @NotBlank(message = "Auditorium name cannot be blank")
    private String name;

    private String format;   // "Standard", "3D", "Laser"...

    @NotNull(message = "Seats cannot be null")
    @PositiveOrZero(message = "Seats must be non-negative")
    private Integer seats;

    public Auditorium() {}

    public Auditorium(Integer id, String name, String format, int seats) {
        this.id = id;
        this.name = name;
        this.format = format;
        this.seats = seats;
    }

    public Integer getId() { return id; }
    public void setId(Integer id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }

    public Integer getSeats() { return seats; }
    public void setSeats(Integer seats) { this.seats = seats; }
}
