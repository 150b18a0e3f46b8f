package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.ReassignmentOutput;
import com.logistics.fleetopsbackend.dto.ReassignmentOutput.DriverRouteOutput;
import com.logistics.fleetopsbackend.dto.ReassignmentOutput.StopLine;
import com.logistics.fleetopsbackend.exception.ResourceNotFoundException;
import com.logistics.fleetopsbackend.model.ReassignmentHistory;
import com.logistics.fleetopsbackend.model.ReassignmentHistory.ReassignmentDetail;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.model.Vehicle;
import com.logistics.fleetopsbackend.repository.ReassignmentHistoryRepository;
import com.logistics.fleetopsbackend.repository.RouteStopRepository;
import com.logistics.fleetopsbackend.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rebuilds the route sheets of the drivers who received work in one
 * reassignment, from the current state of their stops.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReassignmentOutputService {

    private final ReassignmentHistoryRepository historyRepository;
    private final RouteStopRepository routeStopRepository;
    private final VehicleRepository vehicleRepository;
    private final Clock clock;

    public ReassignmentOutput generateOutput(String companyId, String historyId, String generatedBy) {
        ReassignmentHistory history = historyRepository.findByIdAndCompanyId(historyId, companyId)
                .orElseThrow(() -> ResourceNotFoundException.of("Reassignment history", historyId));

        // One sheet per replacement driver, even if they took several routes
        Map<String, List<ReassignmentDetail>> byDriver = new LinkedHashMap<>();
        for (ReassignmentDetail detail : history.getReassignments()) {
            byDriver.computeIfAbsent(detail.getDriverId(), k -> new ArrayList<>()).add(detail);
        }

        Set<String> vehicleIds = history.getReassignments().stream()
                .map(ReassignmentDetail::getVehicleId)
                .collect(Collectors.toSet());
        Map<String, Vehicle> vehicles = vehicleRepository.findByCompanyIdAndIdIn(companyId, vehicleIds).stream()
                .collect(Collectors.toMap(Vehicle::getId, Function.identity()));

        List<DriverRouteOutput> sheets = new ArrayList<>();
        byDriver.forEach((driverId, details) -> sheets.add(buildSheet(companyId, driverId, details, vehicles)));

        int totalStops = sheets.stream().mapToInt(DriverRouteOutput::getTotalStops).sum();
        log.info("🖨️ Regenerated {} route sheets for reassignment {}", sheets.size(), historyId);

        return ReassignmentOutput.builder()
                .reassignmentHistoryId(history.getId())
                .generatedAt(LocalDateTime.now(clock))
                .generatedBy(generatedBy)
                .absentDriverId(history.getAbsentDriverId())
                .absentDriverName(history.getAbsentDriverName())
                .reason(history.getReason())
                .driverRoutes(sheets)
                .summary(new ReassignmentOutput.Summary(totalStops, history.getRouteIds().size(), sheets.size()))
                .build();
    }

    private DriverRouteOutput buildSheet(String companyId, String driverId, List<ReassignmentDetail> details,
                                         Map<String, Vehicle> vehicles) {
        Set<String> recordedStopIds = new LinkedHashSet<>();
        details.forEach(d -> recordedStopIds.addAll(d.getStopIds()));

        List<RouteStop> stops = routeStopRepository.findByCompanyIdAndIdIn(companyId, recordedStopIds).stream()
                .filter(s -> driverId.equals(s.getDriverId()))
                .collect(Collectors.toList());
        if (stops.isEmpty()) {
            // Recorded stops moved on since, show what the driver holds now
            stops = new ArrayList<>(routeStopRepository.findByCompanyIdAndDriverId(companyId, driverId));
        }
        stops.sort(Comparator.comparingInt(RouteStop::getSequence));

        ReassignmentDetail first = details.get(0);
        Vehicle vehicle = vehicles.get(first.getVehicleId());

        List<StopLine> lines = stops.stream()
                .map(s -> StopLine.builder()
                        .sequence(s.getSequence())
                        .orderId(s.getOrderId())
                        .address(s.getAddress())
                        .timeWindowStart(s.getTimeWindowStart())
                        .timeWindowEnd(s.getTimeWindowEnd())
                        .estimatedArrival(s.getEstimatedArrival())
                        .status(s.getStatus() != null ? s.getStatus().name() : null)
                        .notes(s.getNotes())
                        .build())
                .collect(Collectors.toList());

        return DriverRouteOutput.builder()
                .driverId(driverId)
                .driverName(first.getDriverName())
                .vehicleId(first.getVehicleId())
                .vehiclePlate(vehicle != null ? vehicle.getPlate() : "Unknown")
                .stops(lines)
                .totalStops(stops.size())
                .pendingStops((int) stops.stream().filter(s -> s.getStatus() == StopStatus.PENDING).count())
                .completedStops((int) stops.stream().filter(s -> s.getStatus() == StopStatus.COMPLETED).count())
                .build();
    }
}
