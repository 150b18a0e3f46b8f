package com.logistics.fleetopsbackend.routing;

import com.logistics.fleetopsbackend.config.ReassignmentProperties;
import com.logistics.fleetopsbackend.model.RoutePoint;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Straight-line metrics: great-circle distance between consecutive points and
 * a constant average speed for the duration.
 */
@Component
@ConditionalOnProperty(name = "reassignment.metrics.provider", havingValue = "haversine", matchIfMissing = true)
public class HaversineRouteMetricsProvider implements RouteMetricsProvider {

    private static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private final double averageSpeedMetersPerSecond;

    public HaversineRouteMetricsProvider(ReassignmentProperties properties) {
        this.averageSpeedMetersPerSecond = properties.getMetrics().getAverageSpeedKmh() * 1000.0 / 3600.0;
    }

    @Override
    public RouteMetrics computeRouteMetrics(List<RoutePoint> orderedPoints) {
        if (orderedPoints == null || orderedPoints.size() < 2) {
            return RouteMetrics.ZERO;
        }

        double total = 0.0;
        for (int i = 0; i < orderedPoints.size() - 1; i++) {
            RoutePoint p1 = orderedPoints.get(i);
            RoutePoint p2 = orderedPoints.get(i + 1);
            total += haversineDistance(
                    p1.getLatitude(), p1.getLongitude(),
                    p2.getLatitude(), p2.getLongitude());
        }

        return new RouteMetrics(total, Math.round(total / averageSpeedMetersPerSecond));
    }

    static double haversineDistance(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }
}
