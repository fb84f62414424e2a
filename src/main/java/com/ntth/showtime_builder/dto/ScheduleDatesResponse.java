package com.ntth.showtime_builder.dto;

import java.util.List;

public record ScheduleDatesResponse(
        String currentDate,     // ISO
        String currentDisplay,  // MM/DD/YYYY
        List<String> dates
) {}
