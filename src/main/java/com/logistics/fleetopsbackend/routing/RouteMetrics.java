package com.logistics.fleetopsbackend.routing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Length of an ordered point sequence: meters and seconds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteMetrics {
    public static final RouteMetrics ZERO = new RouteMetrics(0.0, 0.0);

    private double distanceMeters;
    private double durationSeconds;
}
