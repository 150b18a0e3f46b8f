package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.CandidateDriver;
import com.logistics.fleetopsbackend.dto.ImpactReport;
import com.logistics.fleetopsbackend.dto.ReassignmentOption;
import com.logistics.fleetopsbackend.model.RouteStop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pairs every eligible candidate with the impact of taking over all of the
 * unavailable driver's outstanding work, then ranks the pairs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptionGenerator {

    private final AffectedWorkLocator affectedWorkLocator;
    private final CandidateRanker candidateRanker;
    private final ImpactCalculator impactCalculator;

    public List<ReassignmentOption> generateOptions(String companyId, String absentDriverId,
                                                    ReassignmentStrategy strategy, String jobId, int limit) {
        List<RouteStop> stops = affectedWorkLocator.findOutstandingStops(companyId, absentDriverId, jobId);
        if (stops.isEmpty()) {
            log.info("✅ Driver {} has no outstanding work, no options to offer", absentDriverId);
            return new ArrayList<>();
        }

        List<String> routeIds = stops.stream()
                .map(RouteStop::getRouteId)
                .distinct()
                .collect(Collectors.toList());

        // Whole candidate pool: truncation happens after ranking
        List<CandidateDriver> candidates = candidateRanker.rankAll(companyId, absentDriverId, strategy, limit);

        List<ReassignmentOption> options = new ArrayList<>();
        for (CandidateDriver candidate : candidates) {
            ImpactReport impact = impactCalculator.computeImpact(companyId, candidate.getId(), stops);
            options.add(new ReassignmentOption(
                    absentDriverId + "-" + candidate.getId(),
                    candidate,
                    impact,
                    strategy,
                    routeIds));
        }

        options.sort(ReassignmentOptionComparator.INSTANCE);
        List<ReassignmentOption> top = options.size() > limit ? new ArrayList<>(options.subList(0, limit)) : options;

        log.info("🧮 {} options evaluated for driver {}, returning {}", options.size(), absentDriverId, top.size());
        return top;
    }
}
