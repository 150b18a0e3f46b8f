package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.AffectedRoute;
import com.logistics.fleetopsbackend.dto.AffectedStop;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.model.Vehicle;
import com.logistics.fleetopsbackend.repository.RouteStopRepository;
import com.logistics.fleetopsbackend.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds the work still outstanding for a driver who can no longer drive it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AffectedWorkLocator {

    static final Set<StopStatus> OPEN_STATUSES = EnumSet.of(StopStatus.PENDING, StopStatus.IN_PROGRESS);

    private static final String UNKNOWN_PLATE = "Unknown";

    private final RouteStopRepository routeStopRepository;
    private final VehicleRepository vehicleRepository;

    /**
     * Outstanding stops owned by the driver, grouped per route/vehicle. Routes come
     * out ordered by route id and stops by sequence. Empty when there is nothing to move.
     */
    public List<AffectedRoute> locateAffectedWork(String companyId, String driverId, String jobId) {
        List<RouteStop> stops = findOutstandingStops(companyId, driverId, jobId);
        if (stops.isEmpty()) {
            log.info("✅ No outstanding stops for driver {} (company {})", driverId, companyId);
            return new ArrayList<>();
        }

        Set<String> vehicleIds = stops.stream()
                .map(RouteStop::getVehicleId)
                .collect(Collectors.toSet());
        Map<String, Vehicle> vehicles = vehicleRepository.findByCompanyIdAndIdIn(companyId, vehicleIds).stream()
                .collect(Collectors.toMap(Vehicle::getId, Function.identity()));

        Map<String, AffectedRoute> routes = new LinkedHashMap<>();
        for (RouteStop stop : stops) {
            String key = stop.getRouteId() + "|" + stop.getVehicleId();
            AffectedRoute route = routes.computeIfAbsent(key, k -> {
                Vehicle vehicle = vehicles.get(stop.getVehicleId());
                String plate = vehicle != null && vehicle.getPlate() != null ? vehicle.getPlate() : UNKNOWN_PLATE;
                return new AffectedRoute(stop.getRouteId(), stop.getVehicleId(), plate);
            });

            route.getStops().add(AffectedStop.from(stop));
            route.setTotalStops(route.getTotalStops() + 1);
            if (stop.getStatus() == StopStatus.PENDING) {
                route.setPendingStops(route.getPendingStops() + 1);
            } else if (stop.getStatus() == StopStatus.IN_PROGRESS) {
                route.setInProgressStops(route.getInProgressStops() + 1);
            }
        }

        log.info("📋 Driver {} has {} outstanding stops on {} routes", driverId, stops.size(), routes.size());
        return new ArrayList<>(routes.values());
    }

    /**
     * Raw PENDING/IN_PROGRESS stops of the driver, optionally scoped to one job,
     * sorted by route then sequence.
     */
    public List<RouteStop> findOutstandingStops(String companyId, String driverId, String jobId) {
        List<RouteStop> stops = jobId != null
                ? routeStopRepository.findByCompanyIdAndJobIdAndDriverIdAndStatusIn(companyId, jobId, driverId, OPEN_STATUSES)
                : routeStopRepository.findByCompanyIdAndDriverIdAndStatusIn(companyId, driverId, OPEN_STATUSES);

        return stops.stream()
                .sorted(Comparator.comparing(RouteStop::getRouteId, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparingInt(RouteStop::getSequence))
                .collect(Collectors.toList());
    }
}
