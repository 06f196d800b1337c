package org.mimir.api;

import org.mimir.report.PerformanceReporter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Objects;

@RestController
@RequestMapping("/api")
public class MetricsController {

    private final PerformanceReporter reporter;

    public MetricsController(PerformanceReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter);
    }

    /** All teams when {@code team} is absent. */
    @GetMapping("/metrics")
    public ApiModels.MetricsView metrics(@RequestParam(value = "team", required = false) String team,
                                         @RequestParam(value = "windowMinutes", defaultValue = "1440") long windowMinutes) {
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("windowMinutes must be positive");
        }
        return ApiModels.MetricsView.from(reporter.metrics(team, Duration.ofMinutes(windowMinutes)));
    }
}
