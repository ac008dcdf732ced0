package com.educonnect.tracking.api;

import com.educonnect.tracking.config.TrackingProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final TrackingProperties properties;

    public HealthController(TrackingProperties properties) {
        this.properties = properties;
    }

    @GetMapping({"/health", "/api/tracking/health"})
    public HealthResponse health() {
        return new HealthResponse("healthy", "tracking-service", properties.serviceVersion());
    }

    public record HealthResponse(String status, String service, String version) {}
}
