package com.logistics.fleetopsbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the driver reassignment engine ({@code reassignment.*}).
 */
@Data
@ConfigurationProperties(prefix = "reassignment")
public class ReassignmentProperties {

    // Max open stops one driver may own after absorbing work
    private int maxStopsPerDriver = 50;

    private int licenseWarningDays = 30;

    private int capacityWarningPercent = 90;
    private int capacityErrorPercent = 100;

    private int defaultCandidateLimit = 10;
    private int maxCandidateLimit = 20;

    private int defaultOptionLimit = 5;

    private int defaultHistoryLimit = 50;
    private int maxHistoryLimit = 100;

    private Metrics metrics = new Metrics();

    @Data
    public static class Metrics {
        // haversine | osrm
        private String provider = "haversine";
        private double averageSpeedKmh = 40.0;
        private String osrmUrl = "https://router.project-osrm.org";
    }
}
