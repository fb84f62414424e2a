package com.ntth.showtime_builder.pojo;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ShowSource {
    PRIME("Prime"),
    MANUAL("Manual"),
    OVERRIDE("Override");

    private final String label;

    ShowSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
