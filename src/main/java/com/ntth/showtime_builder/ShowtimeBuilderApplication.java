package com.ntth.showtime_builder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShowtimeBuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShowtimeBuilderApplication.class, args);
    }
}
