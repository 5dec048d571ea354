package com.incidentsentinel.service;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.IncidentType;
import com.incidentsentinel.core.model.Severity;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared constants and helpers for the service tests.
 */
final class Fixtures {

    static final String RESOURCE =
            "/subscriptions/0000/resourceGroups/rg-demo/providers/Microsoft.Compute/virtualMachines/vm-demo";
    static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {
    }

    /**
     * Directory holding cpu.json, memory.json and network.json.
     */
    static Path metricsDir() {
        URL url = Fixtures.class.getResource("/metrics-fixture/cpu.json");
        if (url == null) {
            throw new IllegalStateException("metrics-fixture not on the test classpath");
        }
        try {
            return Path.of(url.toURI()).getParent();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static Incident incident(IncidentType type, Instant at, Severity severity) {
        return Incident.builder()
                .type(type)
                .resourceId(RESOURCE)
                .timestamp(at)
                .details("details for " + type.getDisplayName())
                .severity(severity)
                .build();
    }
}
