package com.educonnect.tracking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "tracking")
public record TrackingProperties(@DefaultValue("1.0.0") String serviceVersion,
                                 @DefaultValue Cors cors,
                                 @DefaultValue Enrichment enrichment,
                                 @DefaultValue Sweep sweep) {

    public record Cors(@DefaultValue("http://localhost:5173") List<String> allowedOrigins) {}

    public record Enrichment(@DefaultValue("true") boolean enabled) {}

    public record Sweep(@DefaultValue("true") boolean enabled,
                        @DefaultValue("PT12H") Duration maxIdle) {}
}
