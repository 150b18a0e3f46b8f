package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.config.ReassignmentProperties;
import com.logistics.fleetopsbackend.dto.ImpactReport;
import com.logistics.fleetopsbackend.dto.IssueType;
import com.logistics.fleetopsbackend.dto.ReassignmentIssue;
import com.logistics.fleetopsbackend.model.Driver;
import com.logistics.fleetopsbackend.model.DriverStatus;
import com.logistics.fleetopsbackend.model.RoutePoint;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.Skill;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.repository.DriverRepository;
import com.logistics.fleetopsbackend.repository.OrderRepository;
import com.logistics.fleetopsbackend.repository.RouteStopRepository;
import com.logistics.fleetopsbackend.repository.VehicleRepository;
import com.logistics.fleetopsbackend.routing.RouteMetrics;
import com.logistics.fleetopsbackend.routing.RouteMetricsProvider;
import com.logistics.fleetopsbackend.service.SkillService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.logistics.fleetopsbackend.reassignment.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImpactCalculatorTest {

    @Mock
    private AffectedWorkLocator locator;

    @Mock
    private DriverRepository driverRepository;

    @Mock
    private RouteStopRepository routeStopRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private SkillService skillService;

    @Mock
    private RouteMetricsProvider metricsProvider;

    private ReassignmentProperties properties;
    private ImpactCalculator calculator;
    private Driver candidate;

    @BeforeEach
    void setUp() {
        properties = new ReassignmentProperties();
        calculator = new ImpactCalculator(locator, driverRepository, routeStopRepository, skillService,
                new CapacityEstimator(orderRepository, vehicleRepository), metricsProvider, properties, CLOCK);

        candidate = driver("c1", "Candidate", "f1", DriverStatus.AVAILABLE);
        lenient().when(driverRepository.findByIdAndCompanyId("c1", COMPANY)).thenReturn(Optional.of(candidate));

        // 1 km and 2 minutes per leg
        lenient().when(metricsProvider.computeRouteMetrics(anyList())).thenAnswer(inv -> {
            List<RoutePoint> points = inv.getArgument(0);
            int legs = Math.max(0, points.size() - 1);
            return new RouteMetrics(legs * 1000.0, legs * 120.0);
        });
    }

    @Test
    void testComputeImpact_noOutstandingStops_minimalValidReport() {
        when(locator.findOutstandingStops(COMPANY, "d0", null)).thenReturn(List.of());

        ImpactReport report = calculator.computeImpact(COMPANY, "d0", "c1", null);

        assertEquals(0, report.getStopsCount());
        assertTrue(report.isValid());
        assertEquals(0, report.getAdditionalDistance().getAbsolute());
        assertEquals(100, report.getSkillsMatch().getPercentage());
        assertTrue(report.getAvailabilityStatus().isCanAbsorbStops());
        assertEquals(List.of(ImpactCalculator.NO_ACTIVE_ROUTES), messages(report.getWarnings()));
        verifyNoInteractions(driverRepository, metricsProvider);
    }

    @Test
    void testComputeImpact_unknownCandidate_singleBlockingError() {
        when(locator.findOutstandingStops(COMPANY, "d0", null)).thenReturn(pendingStops(3, "r1", "v1", "d0"));
        when(driverRepository.findByIdAndCompanyId("ghost", COMPANY)).thenReturn(Optional.empty());

        ImpactReport report = calculator.computeImpact(COMPANY, "d0", "ghost", null);

        assertFalse(report.isValid());
        assertEquals(1, report.getErrors().size());
        assertEquals(IssueType.NOT_FOUND, report.getErrors().get(0).getType());
        assertEquals(ImpactCalculator.CANDIDATE_NOT_FOUND, report.getErrors().get(0).getMessage());
        assertEquals(0, report.getStopsCount());
        assertEquals(0, report.getAdditionalDistance().getAbsolute());
        assertEquals(0, report.getCapacityUtilization().getProjected());
    }

    @Test
    void testComputeImpact_inactiveCandidate_treatedAsNotFound() {
        candidate.setActive(false);

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(2, "r1", "v1", "d0"));

        assertFalse(report.isValid());
        assertEquals(ImpactCalculator.CANDIDATE_NOT_FOUND, report.getErrors().get(0).getMessage());
    }

    @Test
    void testComputeImpact_candidateWithoutRoute_percentageIs100() {
        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(3, "r1", "v1", "d0"));

        assertEquals(3, report.getStopsCount());
        assertTrue(report.isValid());
        assertEquals("Candidate", report.getReplacementDriverName());
        assertEquals(2000, report.getAdditionalDistance().getAbsolute());
        assertEquals(100, report.getAdditionalDistance().getPercentage());
        assertEquals(100, report.getAdditionalTime().getPercentage());
        assertEquals("4m", report.getAdditionalTime().getFormatted());
        assertEquals(100, report.getSkillsMatch().getPercentage());
        assertEquals(0, report.getAvailabilityStatus().getCurrentStops());
        assertTrue(report.getAvailabilityStatus().isAvailable());
    }

    @Test
    void testComputeImpact_additionRelativeToExistingRoute() {
        when(routeStopRepository.findByCompanyIdAndDriverIdAndStatusIn(COMPANY, "c1", AffectedWorkLocator.OPEN_STATUSES))
                .thenReturn(pendingStops(3, "r9", "v9", "c1"));

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(2, "r1", "v1", "d0"));

        assertEquals(1000, report.getAdditionalDistance().getAbsolute());
        assertEquals(50, report.getAdditionalDistance().getPercentage());
        assertEquals(50, report.getAdditionalTime().getPercentage());
        assertEquals(3, report.getAvailabilityStatus().getCurrentStops());
    }

    @Test
    void testComputeImpact_fiftyStopsFitTheThreshold() {
        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(50, "r1", "v1", "d0"));

        assertTrue(report.getAvailabilityStatus().isCanAbsorbStops());
        assertEquals(50, report.getAvailabilityStatus().getMaxCapacity());
        assertTrue(report.isValid());
    }

    @Test
    void testComputeImpact_fiftyOneStopsCannotBeAbsorbed() {
        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(51, "r1", "v1", "d0"));

        assertFalse(report.getAvailabilityStatus().isCanAbsorbStops());
        assertFalse(report.isValid());
        assertTrue(messages(report.getErrors()).contains("Driver cannot absorb 51 stops. Current: 0, Max: 50"));
    }

    @Test
    void testComputeImpact_licenseExpired_blocks() {
        candidate.setLicenseExpiry(NOW.toLocalDate().minusDays(1));

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(2, "r1", "v1", "d0"));

        assertFalse(report.isValid());
        assertEquals(IssueType.LICENSE, report.getErrors().get(0).getType());
        assertEquals("License expired", report.getErrors().get(0).getMessage());
    }

    @Test
    void testComputeImpact_licenseExpiringSoon_warns() {
        candidate.setLicenseExpiry(NOW.toLocalDate().plusDays(10));

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(2, "r1", "v1", "d0"));

        assertTrue(report.isValid());
        assertTrue(messages(report.getWarnings()).contains("License expires in 10 days"));
    }

    @Test
    void testComputeImpact_statusNotFree_warnsOnly() {
        candidate.setStatus(DriverStatus.ASSIGNED);

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(2, "r1", "v1", "d0"));

        assertTrue(report.isValid());
        assertFalse(report.getAvailabilityStatus().isAvailable());
        assertTrue(messages(report.getWarnings()).contains("Driver status is ASSIGNED"));
    }

    @Test
    void testComputeImpact_partialAndExpiredSkills() {
        List<RouteStop> moved = pendingStops(2, "r1", "v1", "d0");
        when(orderRepository.findByCompanyIdAndIdIn(eq(COMPANY), anyCollection())).thenReturn(List.of(
                order("o-r1-s1", 10, 1, "sk-hazmat"),
                order("o-r1-s2", 10, 1, "sk-hazmat", "sk-cold")));
        when(skillService.getSkillsByCompany(COMPANY)).thenReturn(List.of(
                new Skill("sk-hazmat", COMPANY, "Hazmat"),
                new Skill("sk-cold", COMPANY, "Refrigerated")));
        candidate.setSkills(new ArrayList<>(List.of(
                skill("sk-hazmat", NOW.plusMonths(6)),
                skill("sk-cold", NOW.minusDays(3)))));

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", moved);

        assertEquals(50, report.getSkillsMatch().getPercentage());
        assertEquals(List.of("Refrigerated"), report.getSkillsMatch().getMissing());
        assertTrue(messages(report.getWarnings()).contains("1/2 skills matched"));
        assertTrue(messages(report.getWarnings()).contains("Skill \"Refrigerated\" expired"));
        assertTrue(report.isValid());
    }

    @Test
    void testComputeImpact_projectedCapacityOver100_blocks() {
        RouteStop own = stop("own1", "r9", "v9", "c1", 1, StopStatus.PENDING);
        when(routeStopRepository.findByCompanyIdAndDriverIdAndStatusIn(COMPANY, "c1", AffectedWorkLocator.OPEN_STATUSES))
                .thenReturn(List.of(own));
        when(vehicleRepository.findByCompanyIdAndIdIn(eq(COMPANY), anyCollection()))
                .thenReturn(List.of(vehicle("v1", "TU-1", 500, 100), vehicle("v9", "TU-9", 500, 100)));
        when(orderRepository.findByCompanyIdAndIdIn(eq(COMPANY), anyCollection())).thenReturn(List.of(
                order("o-own1", 500, 10),
                order("o-r1-s1", 300, 10),
                order("o-r1-s2", 300, 10)));

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(2, "r1", "v1", "d0"));

        assertEquals(50, report.getCapacityUtilization().getCurrent());
        assertEquals(110, report.getCapacityUtilization().getProjected());
        assertEquals(0, report.getCapacityUtilization().getAvailable());
        assertFalse(report.isValid());
        assertTrue(messages(report.getErrors()).contains("Capacity constraints violated"));
    }

    @Test
    void testComputeImpact_highCapacity_warnsOnly() {
        when(vehicleRepository.findByCompanyIdAndIdIn(eq(COMPANY), anyCollection()))
                .thenReturn(List.of(vehicle("v1", "TU-1", 1000, 100)));
        when(orderRepository.findByCompanyIdAndIdIn(eq(COMPANY), anyCollection())).thenReturn(List.of(
                order("o-r1-s1", 100, 50),
                order("o-r1-s2", 100, 45)));

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", pendingStops(2, "r1", "v1", "d0"));

        // volume dominates: 95 of 100
        assertEquals(95, report.getCapacityUtilization().getProjected());
        assertEquals(5, report.getCapacityUtilization().getAvailable());
        assertTrue(report.isValid());
        assertTrue(messages(report.getWarnings()).contains("High capacity utilization after reassignment"));
    }

    @Test
    void testComputeImpact_compromisedWindowsAmongWindowedStops() {
        List<RouteStop> moved = pendingStops(3, "r1", "v1", "d0");
        moved.get(0).setTimeWindowStart(NOW);
        moved.get(0).setTimeWindowEnd(NOW.plusHours(1));
        moved.get(0).setEstimatedArrival(NOW.plusHours(2));
        moved.get(1).setTimeWindowStart(NOW);
        moved.get(1).setTimeWindowEnd(NOW.plusHours(3));
        moved.get(1).setEstimatedArrival(NOW.plusHours(2));

        ImpactReport report = calculator.computeImpact(COMPANY, "c1", moved);

        assertEquals(1, report.getCompromisedWindows().getCount());
        assertEquals(50, report.getCompromisedWindows().getPercentage());
    }

    @Test
    void testFormatDuration() {
        assertEquals("1h 30m", ImpactCalculator.formatDuration(5400));
        assertEquals("45m", ImpactCalculator.formatDuration(2700));
        assertEquals("0m", ImpactCalculator.formatDuration(0));
    }

    @Test
    void testPercentageOf_zeroBaseIs100() {
        assertEquals(100, ImpactCalculator.percentageOf(1234, 0));
        assertEquals(100, ImpactCalculator.percentageOf(0, 0));
        assertEquals(25, ImpactCalculator.percentageOf(250, 1000));
    }

    private static List<String> messages(List<ReassignmentIssue> issues) {
        return issues.stream().map(ReassignmentIssue::getMessage).collect(Collectors.toList());
    }
}
