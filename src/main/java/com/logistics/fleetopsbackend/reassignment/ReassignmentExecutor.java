package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.config.ReassignmentProperties;
import com.logistics.fleetopsbackend.dto.ExecutionResult;
import com.logistics.fleetopsbackend.dto.ImpactReport.CapacityImpact;
import com.logistics.fleetopsbackend.dto.IssueType;
import com.logistics.fleetopsbackend.dto.ReassignmentEvent;
import com.logistics.fleetopsbackend.dto.ReassignmentIssue;
import com.logistics.fleetopsbackend.dto.ReassignmentOperationRequest;
import com.logistics.fleetopsbackend.exception.StopOwnershipConflictException;
import com.logistics.fleetopsbackend.model.Driver;
import com.logistics.fleetopsbackend.model.DriverStatus;
import com.logistics.fleetopsbackend.model.ReassignmentHistory;
import com.logistics.fleetopsbackend.model.ReassignmentHistory.ReassignmentDetail;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.repository.DriverRepository;
import com.logistics.fleetopsbackend.repository.ReassignmentHistoryRepository;
import com.logistics.fleetopsbackend.repository.RouteStopRepository;
import com.logistics.fleetopsbackend.service.ReassignmentUpdatePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies a chosen set of per-route reassignments all-or-nothing.
 *
 * <p>Every precondition is checked before the first write. The stop moves, the
 * driver status changes and the history entry then run in one Mongo
 * transaction; each stop move is conditioned on the stop still belonging to the
 * unavailable driver and still being open. Every moved stop is stamped with an
 * id unique to this execution. If the transaction fails, a compensating pass
 * gives back only the stops carrying that stamp and reports what it could not
 * restore.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReassignmentExecutor {

    private final DriverRepository driverRepository;
    private final RouteStopRepository routeStopRepository;
    private final ReassignmentHistoryRepository historyRepository;
    private final CapacityEstimator capacityEstimator;
    private final TransactionTemplate transactionTemplate;
    private final ReassignmentUpdatePublisher updatePublisher;
    private final ReassignmentProperties properties;
    private final Clock clock;

    public ExecutionResult executeReassignment(String companyId, String absentDriverId,
                                               List<ReassignmentOperationRequest> operations,
                                               String reason, String actorId, String jobId) {
        List<ReassignmentIssue> errors = new ArrayList<>();
        List<ReassignmentIssue> warnings = new ArrayList<>();

        if (operations == null || operations.isEmpty()) {
            errors.add(ReassignmentIssue.of(IssueType.VALIDATION, "reassignments",
                    "At least one reassignment is required"));
            return reject(absentDriverId, errors, warnings);
        }

        Driver absentDriver = driverRepository.findByIdAndCompanyId(absentDriverId, companyId).orElse(null);
        if (absentDriver == null) {
            errors.add(ReassignmentIssue.of(IssueType.NOT_FOUND, "absentDriverId", "Absent driver not found"));
            return reject(absentDriverId, errors, warnings);
        }

        Set<String> replacementIds = operations.stream()
                .map(ReassignmentOperationRequest::getToDriverId)
                .filter(id -> id != null)
                .collect(Collectors.toSet());
        Map<String, Driver> replacements = driverRepository.findByCompanyIdAndIdIn(companyId, replacementIds).stream()
                .collect(Collectors.toMap(Driver::getId, Function.identity()));

        validateOperations(operations, absentDriverId, replacements, errors);
        if (!errors.isEmpty()) {
            return reject(absentDriverId, errors, warnings);
        }

        List<PlannedMove> plan = snapshot(companyId, absentDriverId, jobId, operations, errors, warnings);
        if (errors.isEmpty()) {
            checkCapacity(companyId, plan, replacements, errors);
        }
        if (!errors.isEmpty()) {
            return reject(absentDriverId, errors, warnings);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String reassignmentId = UUID.randomUUID().toString();
        List<PlannedMove> attempted = new ArrayList<>();
        List<ReassignmentIssue> executionWarnings = new ArrayList<>();

        ReassignmentHistory history;
        try {
            history = transactionTemplate.execute(status -> migrate(companyId, absentDriver, replacements, plan,
                    reason, actorId, jobId, reassignmentId, now, attempted, executionWarnings));
        } catch (RuntimeException e) {
            return recover(companyId, absentDriverId, reassignmentId, e, attempted, warnings);
        }

        warnings.addAll(executionWarnings);
        int movedStops = history.totalStopCount();
        int movedRoutes = (int) plan.stream().map(m -> m.operation.getRouteId()).distinct().count();

        audit(companyId, absentDriver, history);
        publish(companyId, history);

        return ExecutionResult.builder()
                .success(true)
                .reassignedStops(movedStops)
                .reassignedRoutes(movedRoutes)
                .reassignmentHistoryId(history.getId())
                .warnings(warnings)
                .build();
    }

    private void validateOperations(List<ReassignmentOperationRequest> operations, String absentDriverId,
                                    Map<String, Driver> replacements, List<ReassignmentIssue> errors) {
        Set<String> seenStops = new HashSet<>();
        for (int i = 0; i < operations.size(); i++) {
            ReassignmentOperationRequest op = operations.get(i);
            String field = "reassignments[" + i + "]";

            if (isBlank(op.getRouteId()) || isBlank(op.getVehicleId())) {
                errors.add(ReassignmentIssue.of(IssueType.VALIDATION, field, "Route and vehicle are required"));
            }
            if (op.getStopIds() == null || op.getStopIds().isEmpty()) {
                errors.add(ReassignmentIssue.of(IssueType.VALIDATION, field + ".stopIds", "No stops to reassign"));
            } else {
                for (String stopId : op.getStopIds()) {
                    if (!seenStops.add(stopId)) {
                        errors.add(ReassignmentIssue.of(IssueType.VALIDATION, field + ".stopIds",
                                "Stop " + stopId + " is named by more than one reassignment"));
                    }
                }
            }

            String toDriverId = op.getToDriverId();
            if (isBlank(toDriverId)) {
                errors.add(ReassignmentIssue.of(IssueType.VALIDATION, field + ".toDriverId",
                        "Replacement driver is required"));
                continue;
            }
            if (toDriverId.equals(absentDriverId)) {
                errors.add(ReassignmentIssue.of(IssueType.VALIDATION, field + ".toDriverId",
                        "Replacement driver must differ from the absent driver"));
                continue;
            }

            Driver replacement = replacements.get(toDriverId);
            if (replacement == null) {
                errors.add(ReassignmentIssue.of(IssueType.NOT_FOUND, field + ".toDriverId",
                        "Replacement driver " + toDriverId + " not found"));
            } else if (!replacement.canReceiveWork()) {
                String state = replacement.isActive() ? String.valueOf(replacement.getStatus()) : "inactive";
                errors.add(ReassignmentIssue.of(IssueType.VALIDATION, field + ".toDriverId",
                        "Replacement driver " + replacement.getName() + " is " + state));
            }
        }
    }

    /**
     * Reads which of the named stops the absent driver still owns. Stops already
     * gone are skipped with a warning; an operation left with nothing is an error.
     */
    private List<PlannedMove> snapshot(String companyId, String absentDriverId, String jobId,
                                       List<ReassignmentOperationRequest> operations,
                                       List<ReassignmentIssue> errors, List<ReassignmentIssue> warnings) {
        List<PlannedMove> plan = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            ReassignmentOperationRequest op = operations.get(i);
            List<RouteStop> owned = routeStopRepository
                    .findByCompanyIdAndRouteIdAndVehicleIdAndDriverIdAndIdIn(companyId, op.getRouteId(),
                            op.getVehicleId(), absentDriverId, op.getStopIds())
                    .stream()
                    .filter(s -> s.getStatus() != null && s.getStatus().isOpen())
                    .filter(s -> jobId == null || jobId.equals(s.getJobId()))
                    .collect(Collectors.toList());

            int requested = new HashSet<>(op.getStopIds()).size();
            if (owned.isEmpty()) {
                errors.add(ReassignmentIssue.of(IssueType.CONSISTENCY, "reassignments[" + i + "].stopIds",
                        "None of the " + requested + " stops on route " + op.getRouteId()
                                + " are still outstanding for the absent driver"));
                continue;
            }
            if (owned.size() < requested) {
                warnings.add(ReassignmentIssue.of(IssueType.CONSISTENCY, "reassignments[" + i + "].stopIds",
                        (requested - owned.size()) + " of " + requested + " stops on route " + op.getRouteId()
                                + " are no longer outstanding for the absent driver and were skipped"));
            }
            plan.add(new PlannedMove(op, owned));
        }
        return plan;
    }

    private void checkCapacity(String companyId, List<PlannedMove> plan, Map<String, Driver> replacements,
                               List<ReassignmentIssue> errors) {
        Map<String, List<RouteStop>> incoming = new LinkedHashMap<>();
        for (PlannedMove move : plan) {
            incoming.computeIfAbsent(move.operation.getToDriverId(), k -> new ArrayList<>()).addAll(move.stops);
        }

        int maxStops = properties.getMaxStopsPerDriver();
        incoming.forEach((driverId, stops) -> {
            String name = replacements.get(driverId).getName();
            List<RouteStop> open = routeStopRepository.findByCompanyIdAndDriverIdAndStatusIn(
                    companyId, driverId, AffectedWorkLocator.OPEN_STATUSES);
            long pending = open.stream().filter(s -> s.getStatus() == StopStatus.PENDING).count();

            if (pending + stops.size() > maxStops) {
                errors.add(ReassignmentIssue.of(IssueType.CAPACITY, "availabilityStatus",
                        "Driver " + name + " cannot absorb " + stops.size() + " stops. Current: " + pending
                                + ", Max: " + maxStops));
            }
            CapacityImpact capacity = capacityEstimator.estimate(companyId, open, stops);
            if (capacity.getProjected() > properties.getCapacityErrorPercent()) {
                errors.add(ReassignmentIssue.of(IssueType.CAPACITY, "capacityUtilization",
                        "Capacity constraints violated for driver " + name + " (" + capacity.getProjected() + "%)"));
            }
        });
    }

    private ReassignmentHistory migrate(String companyId, Driver absentDriver, Map<String, Driver> replacements,
                                        List<PlannedMove> plan, String reason, String actorId, String jobId,
                                        String reassignmentId, LocalDateTime now, List<PlannedMove> attempted,
                                        List<ReassignmentIssue> warnings) {
        ReassignmentHistory.ReassignmentHistoryBuilder history = ReassignmentHistory.builder()
                .companyId(companyId)
                .jobId(jobId)
                .absentDriverId(absentDriver.getId())
                .absentDriverName(absentDriver.getName())
                .reason(reason)
                .executedBy(actorId)
                .executedAt(now);

        for (PlannedMove move : plan) {
            ReassignmentOperationRequest op = move.operation;
            attempted.add(move);

            long moved = routeStopRepository.reassignOwnedStops(companyId, op.getRouteId(), op.getVehicleId(),
                    absentDriver.getId(), op.getToDriverId(), move.stopIds(), reassignmentId, now);
            if (moved != move.stops.size()) {
                throw new StopOwnershipConflictException(op.getRouteId(), move.stops.size(), moved);
            }

            history.reassignment(ReassignmentDetail.builder()
                    .driverId(op.getToDriverId())
                    .driverName(replacements.get(op.getToDriverId()).getName())
                    .routeId(op.getRouteId())
                    .vehicleId(op.getVehicleId())
                    .stopIds(move.stopIds())
                    .stopCount(move.stops.size())
                    .build());
        }

        for (String driverId : plan.stream().map(m -> m.operation.getToDriverId()).distinct().collect(Collectors.toList())) {
            if (routeStopRepository.existsByCompanyIdAndDriverIdAndStatus(companyId, driverId, StopStatus.IN_PROGRESS)) {
                moveToStatus(companyId, replacements.get(driverId), DriverStatus.IN_ROUTE, warnings);
            }
        }

        long remaining = routeStopRepository.countByCompanyIdAndDriverIdAndStatusIn(
                companyId, absentDriver.getId(), AffectedWorkLocator.OPEN_STATUSES);
        if (remaining == 0 && absentDriver.getStatus() == DriverStatus.ABSENT) {
            if (driverRepository.transitionStatus(companyId, absentDriver.getId(),
                    DriverStatus.ABSENT, DriverStatus.UNAVAILABLE)) {
                warnings.add(ReassignmentIssue.of(IssueType.INFO, "absentDriverId",
                        "Absent driver " + absentDriver.getName() + " status updated to UNAVAILABLE"));
            } else {
                log.warn("⚠️ Driver {} changed status concurrently, left as is", absentDriver.getId());
            }
        }

        history.routeIds(plan.stream().map(m -> m.operation.getRouteId()).distinct().collect(Collectors.toList()));
        history.vehicleIds(plan.stream().map(m -> m.operation.getVehicleId()).distinct().collect(Collectors.toList()));

        return historyRepository.insert(history.build());
    }

    private void moveToStatus(String companyId, Driver driver, DriverStatus target, List<ReassignmentIssue> warnings) {
        DriverStatus current = driver.getStatus();
        if (current == target) {
            return;
        }
        if (!current.canTransitionTo(target)) {
            warnings.add(ReassignmentIssue.of(IssueType.STATUS, "toDriverId",
                    "Driver " + driver.getName() + " cannot move from " + current + " to " + target));
            return;
        }
        if (driverRepository.transitionStatus(companyId, driver.getId(), current, target)) {
            log.info("🚚 Driver {} status {} -> {}", driver.getId(), current, target);
        } else {
            warnings.add(ReassignmentIssue.of(IssueType.STATUS, "toDriverId",
                    "Driver " + driver.getName() + " changed status concurrently, not moved to " + target));
        }
    }

    /**
     * Runs after the transaction has failed. Normally the transaction rollback
     * already restored every stop and this pass finds nothing to do. Stops moved
     * by another execution never carry this execution's id and are left alone.
     */
    private ExecutionResult recover(String companyId, String absentDriverId, String reassignmentId,
                                    RuntimeException failure,
                                    List<PlannedMove> attempted, List<ReassignmentIssue> warnings) {
        List<ReassignmentIssue> errors = new ArrayList<>();
        if (failure instanceof StopOwnershipConflictException) {
            errors.add(ReassignmentIssue.of(IssueType.CONSISTENCY, "reassignments", failure.getMessage()));
        } else {
            errors.add(ReassignmentIssue.of(IssueType.PARTIAL_FAILURE, "reassignments",
                    "Reassignment failed: " + failure.getMessage()));
        }
        log.error("❌ Reassignment for driver {} failed, reverting {} operations",
                absentDriverId, attempted.size(), failure);

        List<ReassignmentIssue> rollbackErrors = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, String> expectedOwner = new LinkedHashMap<>();

        for (PlannedMove move : attempted) {
            String toDriverId = move.operation.getToDriverId();
            for (String stopId : move.stopIds()) {
                expectedOwner.put(stopId, toDriverId);
                try {
                    if (routeStopRepository.restoreStopOwner(companyId, stopId, toDriverId, absentDriverId,
                            reassignmentId, now)) {
                        log.warn("↩️ Stop {} given back to driver {}", stopId, absentDriverId);
                    }
                } catch (RuntimeException e) {
                    log.error("❌ Failed to rollback stop {}", stopId, e);
                    rollbackErrors.add(ReassignmentIssue.of(IssueType.ROLLBACK_FAILURE, "reassignments",
                            "Failed to rollback stop " + stopId + ": " + e.getMessage()));
                }
            }
        }

        if (rollbackErrors.isEmpty() && !expectedOwner.isEmpty()) {
            verifyRestored(companyId, reassignmentId, expectedOwner, rollbackErrors);
        }

        boolean manual = !rollbackErrors.isEmpty();
        if (manual) {
            errors.addAll(rollbackErrors);
            errors.add(ReassignmentIssue.of(IssueType.ROLLBACK_FAILURE, "reassignments",
                    "Partial rollback may have occurred - manual verification required"));
        } else {
            warnings.add(ReassignmentIssue.of(IssueType.INFO, "reassignments",
                    "All changes were rolled back successfully"));
        }

        ExecutionResult result = ExecutionResult.failure(errors, warnings);
        result.setManualVerificationRequired(manual);
        return result;
    }

    // A stop still held by the replacement with this execution's stamp was not restored
    private void verifyRestored(String companyId, String reassignmentId, Map<String, String> expectedOwner,
                                List<ReassignmentIssue> rollbackErrors) {
        try {
            for (RouteStop stop : routeStopRepository.findByCompanyIdAndIdIn(companyId, expectedOwner.keySet())) {
                if (expectedOwner.get(stop.getId()).equals(stop.getDriverId())
                        && reassignmentId.equals(stop.getReassignmentId())) {
                    rollbackErrors.add(ReassignmentIssue.of(IssueType.ROLLBACK_FAILURE, "reassignments",
                            "Failed to rollback stop " + stop.getId() + ": still owned by driver " + stop.getDriverId()));
                }
            }
        } catch (RuntimeException e) {
            log.error("❌ Could not verify rollback", e);
            rollbackErrors.add(ReassignmentIssue.of(IssueType.ROLLBACK_FAILURE, "reassignments",
                    "Could not verify rollback: " + e.getMessage()));
        }
    }

    private ExecutionResult reject(String absentDriverId, List<ReassignmentIssue> errors,
                                   List<ReassignmentIssue> warnings) {
        log.warn("⚠️ Reassignment for driver {} rejected before any change: {}", absentDriverId,
                errors.stream().map(ReassignmentIssue::getMessage).collect(Collectors.joining("; ")));
        return ExecutionResult.failure(errors, warnings);
    }

    private void audit(String companyId, Driver absentDriver, ReassignmentHistory history) {
        log.info("📝 AUDIT reassignment {} company={} absentDriver={} ({}) by={} stops={} reason={}",
                history.getId(), companyId, absentDriver.getId(), absentDriver.getName(),
                history.getExecutedBy(), history.totalStopCount(), history.getReason());
        for (ReassignmentDetail detail : history.getReassignments()) {
            log.info("📝 AUDIT reassignment {} {} -> {} ({}) vehicle={} route={} stops={}",
                    history.getId(), absentDriver.getId(), detail.getDriverId(), detail.getDriverName(),
                    detail.getVehicleId(), detail.getRouteId(), detail.getStopCount());
        }
    }

    // Committed already: a failed broadcast only costs the live view a refresh
    private void publish(String companyId, ReassignmentHistory history) {
        ReassignmentEvent event = new ReassignmentEvent(
                companyId,
                history.getId(),
                history.getAbsentDriverId(),
                history.getReassignments().stream().map(ReassignmentDetail::getDriverId).distinct()
                        .collect(Collectors.toList()),
                history.getRouteIds(),
                history.totalStopCount(),
                history.getExecutedAt());
        try {
            updatePublisher.publishReassignment(event);
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not publish reassignment {}: {}", history.getId(), e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class PlannedMove {
        private final ReassignmentOperationRequest operation;
        private final List<RouteStop> stops;

        private PlannedMove(ReassignmentOperationRequest operation, List<RouteStop> stops) {
            this.operation = operation;
            this.stops = stops;
        }

        List<String> stopIds() {
            return stops.stream().map(RouteStop::getId).collect(Collectors.toList());
        }
    }
}
