package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.config.ReassignmentProperties;
import com.logistics.fleetopsbackend.dto.ImpactReport;
import com.logistics.fleetopsbackend.dto.ImpactReport.AvailabilityStatus;
import com.logistics.fleetopsbackend.dto.ImpactReport.CapacityImpact;
import com.logistics.fleetopsbackend.dto.ImpactReport.DistanceImpact;
import com.logistics.fleetopsbackend.dto.ImpactReport.SkillsMatch;
import com.logistics.fleetopsbackend.dto.ImpactReport.TimeImpact;
import com.logistics.fleetopsbackend.dto.ImpactReport.WindowImpact;
import com.logistics.fleetopsbackend.dto.IssueType;
import com.logistics.fleetopsbackend.dto.ReassignmentIssue;
import com.logistics.fleetopsbackend.model.Driver;
import com.logistics.fleetopsbackend.model.DriverSkill;
import com.logistics.fleetopsbackend.model.Order;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.Skill;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.repository.DriverRepository;
import com.logistics.fleetopsbackend.repository.RouteStopRepository;
import com.logistics.fleetopsbackend.routing.RouteMetrics;
import com.logistics.fleetopsbackend.routing.RouteMetricsProvider;
import com.logistics.fleetopsbackend.service.SkillService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes what it would cost one candidate driver to take over all of an
 * unavailable driver's outstanding stops. Advisory only: reads, never writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImpactCalculator {

    static final String NO_ACTIVE_ROUTES = "No active routes found for driver";
    static final String CANDIDATE_NOT_FOUND = "Replacement driver not found";

    private static final Comparator<RouteStop> BY_SEQUENCE = Comparator
            .comparingInt(RouteStop::getSequence)
            .thenComparing(RouteStop::getRouteId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AffectedWorkLocator affectedWorkLocator;
    private final DriverRepository driverRepository;
    private final RouteStopRepository routeStopRepository;
    private final SkillService skillService;
    private final CapacityEstimator capacityEstimator;
    private final RouteMetricsProvider routeMetricsProvider;
    private final ReassignmentProperties properties;
    private final Clock clock;

    public ImpactReport computeImpact(String companyId, String absentDriverId, String candidateId, String jobId) {
        List<RouteStop> movedStops = affectedWorkLocator.findOutstandingStops(companyId, absentDriverId, jobId);
        return computeImpact(companyId, candidateId, movedStops);
    }

    /**
     * Impact of moving the given, already located, stops to the candidate.
     */
    ImpactReport computeImpact(String companyId, String candidateId, List<RouteStop> movedStops) {
        if (movedStops.isEmpty()) {
            return noAffectedWork(candidateId);
        }

        Optional<Driver> found = driverRepository.findByIdAndCompanyId(candidateId, companyId)
                .filter(Driver::isActive);
        if (found.isEmpty()) {
            log.warn("⚠️ Impact requested for unknown or inactive driver {} (company {})", candidateId, companyId);
            return candidateNotFound(candidateId);
        }
        Driver candidate = found.get();

        LocalDateTime now = LocalDateTime.now(clock);
        List<ReassignmentIssue> errors = new ArrayList<>();
        List<ReassignmentIssue> warnings = new ArrayList<>();

        checkLicense(candidate, LocalDate.now(clock), errors, warnings);

        boolean available = candidate.getStatus() != null && candidate.getStatus().isFreeForWork();
        if (!available) {
            warnings.add(ReassignmentIssue.of(IssueType.STATUS, "availabilityStatus",
                    "Driver status is " + candidate.getStatus()));
        }

        List<RouteStop> candidateOpenStops = routeStopRepository.findByCompanyIdAndDriverIdAndStatusIn(
                companyId, candidateId, AffectedWorkLocator.OPEN_STATUSES);
        List<RouteStop> candidatePending = candidateOpenStops.stream()
                .filter(s -> s.getStatus() == StopStatus.PENDING)
                .sorted(BY_SEQUENCE)
                .collect(Collectors.toList());
        List<RouteStop> moved = movedStops.stream().sorted(BY_SEQUENCE).collect(Collectors.toList());

        // Absorb threshold
        int maxStops = properties.getMaxStopsPerDriver();
        boolean canAbsorb = candidatePending.size() + moved.size() <= maxStops;
        if (!canAbsorb) {
            errors.add(ReassignmentIssue.of(IssueType.CAPACITY, "availabilityStatus",
                    "Driver cannot absorb " + moved.size() + " stops. Current: " + candidatePending.size()
                            + ", Max: " + maxStops));
        }

        // Distance and time
        RouteMetrics current = routeMetricsProvider.computeRouteMetrics(
                candidatePending.stream().map(RouteStop::toRoutePoint).collect(Collectors.toList()));
        RouteMetrics added = routeMetricsProvider.computeRouteMetrics(
                moved.stream().map(RouteStop::toRoutePoint).collect(Collectors.toList()));

        DistanceImpact distance = new DistanceImpact(
                Math.round(added.getDistanceMeters()),
                percentageOf(added.getDistanceMeters(), current.getDistanceMeters()));
        TimeImpact time = new TimeImpact(
                Math.round(added.getDurationSeconds()),
                percentageOf(added.getDurationSeconds(), current.getDurationSeconds()),
                formatDuration(added.getDurationSeconds()));

        WindowImpact windows = compromisedWindows(moved);

        // Capacity
        Map<String, Order> orders = capacityEstimator.loadOrders(companyId, candidateOpenStops, moved);
        CapacityImpact capacity = capacityEstimator.estimate(companyId, candidateOpenStops, moved, orders);
        if (capacity.getProjected() > properties.getCapacityErrorPercent()) {
            errors.add(ReassignmentIssue.of(IssueType.CAPACITY, "capacityUtilization",
                    "Capacity constraints violated"));
        } else if (capacity.getProjected() > properties.getCapacityWarningPercent()) {
            warnings.add(ReassignmentIssue.of(IssueType.CAPACITY, "capacityUtilization",
                    "High capacity utilization after reassignment"));
        }

        SkillsMatch skills = matchSkills(companyId, candidate, moved, orders, now, warnings);

        boolean valid = errors.isEmpty() && canAbsorb;
        log.info("📊 Impact of {} stops on driver {}: valid={}, capacity {}% -> {}%, skills {}%",
                moved.size(), candidateId, valid, capacity.getCurrent(), capacity.getProjected(),
                skills.getPercentage());

        return ImpactReport.builder()
                .replacementDriverId(candidate.getId())
                .replacementDriverName(candidate.getName())
                .stopsCount(moved.size())
                .additionalDistance(distance)
                .additionalTime(time)
                .compromisedWindows(windows)
                .capacityUtilization(capacity)
                .skillsMatch(skills)
                .availabilityStatus(new AvailabilityStatus(available, candidatePending.size(), maxStops, canAbsorb))
                .valid(valid)
                .errors(errors)
                .warnings(warnings)
                .build();
    }

    private void checkLicense(Driver candidate, LocalDate today,
                              List<ReassignmentIssue> errors, List<ReassignmentIssue> warnings) {
        LocalDate expiry = candidate.getLicenseExpiry();
        if (expiry == null) {
            return;
        }
        if (expiry.isBefore(today)) {
            errors.add(ReassignmentIssue.of(IssueType.LICENSE, "availabilityStatus", "License expired"));
            return;
        }
        long days = ChronoUnit.DAYS.between(today, expiry);
        if (days <= properties.getLicenseWarningDays()) {
            warnings.add(ReassignmentIssue.of(IssueType.LICENSE, "availabilityStatus",
                    "License expires in " + days + " days"));
        }
    }

    private SkillsMatch matchSkills(String companyId, Driver candidate, List<RouteStop> moved,
                                    Map<String, Order> orders, LocalDateTime now,
                                    List<ReassignmentIssue> warnings) {
        Set<String> required = new LinkedHashSet<>();
        for (RouteStop stop : moved) {
            Order order = stop.getOrderId() != null ? orders.get(stop.getOrderId()) : null;
            if (order != null) {
                required.addAll(order.getRequiredSkills());
            }
        }

        Set<String> held = candidate.getSkills().stream()
                .filter(DriverSkill::isActive)
                .filter(s -> !s.isExpiredAt(now))
                .map(DriverSkill::getSkillId)
                .collect(Collectors.toSet());

        Map<String, String> names = skillService.getSkillsByCompany(companyId).stream()
                .collect(Collectors.toMap(Skill::getId, Skill::getName, (a, b) -> a));

        List<String> missing = required.stream()
                .filter(id -> !held.contains(id))
                .map(id -> names.getOrDefault(id, id))
                .collect(Collectors.toList());
        int matched = required.size() - missing.size();
        long percentage = required.isEmpty() ? 100 : Math.round(matched * 100.0 / required.size());

        if (!required.isEmpty() && percentage < 100) {
            warnings.add(ReassignmentIssue.of(IssueType.SKILLS, "skillsMatch",
                    matched + "/" + required.size() + " skills matched"));
        }

        candidate.getSkills().stream()
                .filter(DriverSkill::isActive)
                .filter(s -> s.isExpiredAt(now))
                .forEach(s -> warnings.add(ReassignmentIssue.of(IssueType.SKILLS, "skillsMatch",
                        "Skill \"" + names.getOrDefault(s.getSkillId(), s.getSkillId()) + "\" expired")));

        return new SkillsMatch(percentage, missing);
    }

    private static WindowImpact compromisedWindows(List<RouteStop> moved) {
        long windowed = moved.stream().filter(RouteStop::hasTimeWindow).count();
        int compromised = (int) moved.stream().filter(RouteStop::isWindowCompromised).count();
        long percentage = windowed > 0 ? Math.round(compromised * 100.0 / windowed) : 0;
        return new WindowImpact(compromised, percentage);
    }

    /**
     * Addition relative to what the candidate already drives. 100 when the
     * candidate drives nothing yet.
     */
    static long percentageOf(double added, double existing) {
        if (existing <= 0) {
            return 100;
        }
        return Math.round(added / existing * 100);
    }

    static String formatDuration(double seconds) {
        long totalMinutes = Math.round(seconds / 60);
        long hours = totalMinutes / 60;
        long minutes = totalMinutes % 60;
        return hours > 0 ? hours + "h " + minutes + "m" : minutes + "m";
    }

    private ImpactReport noAffectedWork(String candidateId) {
        List<ReassignmentIssue> warnings = new ArrayList<>();
        warnings.add(ReassignmentIssue.of(IssueType.INFO, "stopsCount", NO_ACTIVE_ROUTES));
        return zeroedReport(candidateId)
                .skillsMatch(new SkillsMatch(100, new ArrayList<>()))
                .availabilityStatus(new AvailabilityStatus(true, 0, properties.getMaxStopsPerDriver(), true))
                .valid(true)
                .warnings(warnings)
                .build();
    }

    private ImpactReport candidateNotFound(String candidateId) {
        List<ReassignmentIssue> errors = new ArrayList<>();
        errors.add(ReassignmentIssue.of(IssueType.NOT_FOUND, "replacementDriverId", CANDIDATE_NOT_FOUND));
        return zeroedReport(candidateId)
                .skillsMatch(new SkillsMatch(0, new ArrayList<>()))
                .availabilityStatus(new AvailabilityStatus(false, 0, properties.getMaxStopsPerDriver(), false))
                .valid(false)
                .errors(errors)
                .build();
    }

    private static ImpactReport.ImpactReportBuilder zeroedReport(String candidateId) {
        return ImpactReport.builder()
                .replacementDriverId(candidateId)
                .replacementDriverName("")
                .stopsCount(0)
                .additionalDistance(new DistanceImpact(0, 0))
                .additionalTime(new TimeImpact(0, 0, "0m"))
                .compromisedWindows(new WindowImpact(0, 0))
                .capacityUtilization(new CapacityImpact(0, 0, 100));
    }
}
