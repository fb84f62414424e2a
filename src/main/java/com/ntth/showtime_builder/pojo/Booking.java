package com.ntth.showtime_builder.pojo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** A film booked into a numbered slot for a scheduling week; each booking backs one prime row. */
@Document(collection = "bookings")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    private String id;
    private Integer week;
    private String slot;
    private String filmId;
    private String notes;
    private Integer weeksOut;
}
