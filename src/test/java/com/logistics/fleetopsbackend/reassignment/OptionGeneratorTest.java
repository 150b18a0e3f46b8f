package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.CandidateDriver;
import com.logistics.fleetopsbackend.dto.ImpactReport;
import com.logistics.fleetopsbackend.dto.ReassignmentOption;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.logistics.fleetopsbackend.reassignment.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OptionGeneratorTest {

    @Mock
    private AffectedWorkLocator locator;

    @Mock
    private CandidateRanker ranker;

    @Mock
    private ImpactCalculator impactCalculator;

    @InjectMocks
    private OptionGenerator generator;

    @Test
    void testGenerateOptions_ranksWholePoolBeforeTruncating() {
        List<RouteStop> stops = List.of(
                stop("s1", "r1", "v1", "d0", 1, StopStatus.PENDING),
                stop("s2", "r1", "v1", "d0", 2, StopStatus.PENDING),
                stop("s3", "r2", "v2", "d0", 1, StopStatus.PENDING));
        when(locator.findOutstandingStops(COMPANY, "d0", null)).thenReturn(stops);
        when(ranker.rankAll(COMPANY, "d0", ReassignmentStrategy.ANY_FLEET, 2)).thenReturn(List.of(
                new CandidateDriver("c1", "Amel", "f1", "North", PriorityTier.SAME_FLEET),
                new CandidateDriver("c2", "Badr", "f2", "South", PriorityTier.SAME_FLEET_TYPE),
                new CandidateDriver("c3", "Chedly", "f3", "East", PriorityTier.OTHER_FLEET)));
        when(impactCalculator.computeImpact(COMPANY, "c1", stops)).thenReturn(impact(false));
        when(impactCalculator.computeImpact(COMPANY, "c2", stops)).thenReturn(impact(true));
        when(impactCalculator.computeImpact(COMPANY, "c3", stops)).thenReturn(impact(true));

        List<ReassignmentOption> options = generator.generateOptions(COMPANY, "d0", ReassignmentStrategy.ANY_FLEET, null, 2);

        assertEquals(List.of("d0-c2", "d0-c3"),
                options.stream().map(ReassignmentOption::getOptionId).collect(Collectors.toList()));
        assertEquals(List.of("r1", "r2"), options.get(0).getRouteIds());
        assertEquals(ReassignmentStrategy.ANY_FLEET, options.get(0).getStrategy());
    }

    @Test
    void testGenerateOptions_noOutstandingWork_empty() {
        when(locator.findOutstandingStops(COMPANY, "d0", JOB)).thenReturn(List.of());

        List<ReassignmentOption> options = generator.generateOptions(COMPANY, "d0", ReassignmentStrategy.SAME_FLEET, JOB, 5);

        assertTrue(options.isEmpty());
        verifyNoInteractions(ranker, impactCalculator);
    }

    @Test
    void testGenerateOptions_sameFleetValidRanksFirst() {
        List<RouteStop> stops = List.of(stop("s1", "r1", "v1", "d0", 1, StopStatus.PENDING));
        when(locator.findOutstandingStops(COMPANY, "d0", null)).thenReturn(stops);
        when(ranker.rankAll(eq(COMPANY), eq("d0"), eq(ReassignmentStrategy.SAME_FLEET), anyInt())).thenReturn(List.of(
                new CandidateDriver("c3", "Chedly", "f3", "East", PriorityTier.OTHER_FLEET),
                new CandidateDriver("c1", "Amel", "f1", "North", PriorityTier.SAME_FLEET)));
        when(impactCalculator.computeImpact(eq(COMPANY), anyString(), eq(stops))).thenReturn(impact(true));

        List<ReassignmentOption> options = generator.generateOptions(COMPANY, "d0", ReassignmentStrategy.SAME_FLEET, null, 5);

        assertEquals("c1", options.get(0).getReplacementDriver().getId());
        assertEquals(2, options.size());
    }

    private static ImpactReport impact(boolean valid) {
        return ImpactReport.builder()
                .valid(valid)
                .stopsCount(3)
                .compromisedWindows(new ImpactReport.WindowImpact(0, 0))
                .skillsMatch(new ImpactReport.SkillsMatch(100, new ArrayList<>()))
                .build();
    }
}
