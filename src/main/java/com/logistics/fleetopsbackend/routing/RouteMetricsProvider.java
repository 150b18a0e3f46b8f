package com.logistics.fleetopsbackend.routing;

import com.logistics.fleetopsbackend.model.RoutePoint;

import java.util.List;

/**
 * Distance/duration of a route visiting the points in the given order.
 * Implementations must be deterministic for a fixed input order and return
 * {@link RouteMetrics#ZERO} for fewer than two points.
 */
public interface RouteMetricsProvider {

    RouteMetrics computeRouteMetrics(List<RoutePoint> orderedPoints);
}
