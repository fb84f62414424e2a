package com.ntth.showtime_builder.Config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "showtime")
@Validated
@Getter
@Setter
public class ShowtimeProperties {
    @NotBlank
    private String zone = "Asia/Ho_Chi_Minh";   // HH:MM strings and the 05:00 rollover use this zone

    @Min(14)
    private int retentionDays = 14;

    @Pattern(regexp = "^\\d{1,2}:\\d{1,2}$")
    private String firstShow = "07:00";

    @Pattern(regexp = "^\\d{1,2}:\\d{1,2}$")
    private String lastShow = "23:00";          // may be after midnight, e.g. "01:30"

    private boolean seedDefaults = true;

    @NotBlank
    private String stateCollection = "showtime_state";

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
