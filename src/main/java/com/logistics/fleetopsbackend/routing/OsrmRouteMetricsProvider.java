package com.logistics.fleetopsbackend.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.fleetopsbackend.config.ReassignmentProperties;
import com.logistics.fleetopsbackend.model.RoutePoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Road-network metrics from an OSRM server. Falls back to straight-line
 * metrics when OSRM is unreachable or answers with an error code. Not retried.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reassignment.metrics.provider", havingValue = "osrm")
public class OsrmRouteMetricsProvider implements RouteMetricsProvider {

    private final String osrmUrl;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final HaversineRouteMetricsProvider fallback;

    public OsrmRouteMetricsProvider(ReassignmentProperties properties) {
        this(properties, new RestTemplate(), new ObjectMapper());
    }

    OsrmRouteMetricsProvider(ReassignmentProperties properties, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.osrmUrl = properties.getMetrics().getOsrmUrl();
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.fallback = new HaversineRouteMetricsProvider(properties);
    }

    @Override
    public RouteMetrics computeRouteMetrics(List<RoutePoint> orderedPoints) {
        if (orderedPoints == null || orderedPoints.size() < 2) {
            return RouteMetrics.ZERO;
        }

        // OSRM uses lng,lat
        List<String> coordinates = new ArrayList<>();
        for (RoutePoint point : orderedPoints) {
            coordinates.add(point.getLongitude() + "," + point.getLatitude());
        }
        String url = osrmUrl + "/route/v1/driving/" + String.join(";", coordinates) + "?overview=false";

        try {
            String response = restTemplate.getForObject(url, String.class);
            JsonNode root = objectMapper.readTree(response);

            JsonNode route = root.path("routes").path(0);
            if ("Ok".equals(root.path("code").asText()) && !route.isMissingNode()) {
                return new RouteMetrics(route.path("distance").asDouble(), route.path("duration").asDouble());
            }
            log.warn("⚠️ OSRM returned code: {}, using straight-line metrics", root.path("code").asText());
        } catch (RestClientException | IOException e) {
            log.warn("⚠️ OSRM request failed: {}, using straight-line metrics", e.getMessage());
        }
        return fallback.computeRouteMetrics(orderedPoints);
    }
}
