package com.ntth.showtime_builder.controller;

import com.ntth.showtime_builder.service.DowntimeAnalyzer;
import com.ntth.showtime_builder.service.ScheduleAuditor;
import com.ntth.showtime_builder.service.ScheduleService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final ScheduleService scheduleService;

    public AuditController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    // longest idle time first
    @GetMapping("/issues")
    public List<DowntimeAnalyzer.Issue> issues() {
        return scheduleService.issues();
    }

    @GetMapping("/flags")
    public ScheduleAuditor.FlaggedCounts flags() {
        return scheduleService.flaggedCounts();
    }

    @GetMapping("/report")
    public ScheduleAuditor.AuditReport report() {
        return scheduleService.audit();
    }

    @GetMapping("/order")
    public List<ScheduleAuditor.OrderLine> startTimeOrder() {
        return scheduleService.startTimeOrder();
    }
}
