package com.webanalytics.funnel.metrics;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint exposing service metrics.
 *
 * Used by dashboards, debugging tools, and tests.
 */
@RestController
@RequiredArgsConstructor
public class MetricsController {

    private final Metrics metrics;

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }
}
