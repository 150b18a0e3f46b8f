package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.CandidateDriver;
import com.logistics.fleetopsbackend.model.Driver;
import com.logistics.fleetopsbackend.model.DriverStatus;
import com.logistics.fleetopsbackend.model.Fleet;
import com.logistics.fleetopsbackend.repository.DriverRepository;
import com.logistics.fleetopsbackend.service.FleetService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Orders the drivers who could take over an unavailable driver's work by
 * fleet affinity: same fleet, then same fleet type, then any other fleet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateRanker {

    static final Comparator<CandidateDriver> BY_TIER_THEN_NAME = Comparator
            .comparing(CandidateDriver::getPriority)
            .thenComparing(CandidateDriver::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(CandidateDriver::getId);

    private final DriverRepository driverRepository;
    private final FleetService fleetService;

    /**
     * At most {@code limit} candidates, best first. Unknown unavailable driver
     * yields an empty list. The job scope does not narrow the candidate pool.
     */
    public List<CandidateDriver> rankCandidates(String companyId, String absentDriverId,
                                                ReassignmentStrategy strategy, String jobId, int limit) {
        List<CandidateDriver> ranked = rankAll(companyId, absentDriverId, strategy, limit);
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
    }

    /**
     * Every eligible candidate, sorted but not truncated. {@code backfillTarget}
     * only decides whether a same-fleet-only request falls back to other fleets.
     */
    List<CandidateDriver> rankAll(String companyId, String absentDriverId,
                                  ReassignmentStrategy strategy, int backfillTarget) {
        Optional<Driver> absent = driverRepository.findByIdAndCompanyId(absentDriverId, companyId);
        if (absent.isEmpty()) {
            log.warn("⚠️ Unavailable driver {} not found in company {}", absentDriverId, companyId);
            return new ArrayList<>();
        }
        String absentFleetId = absent.get().getFleetId();

        Map<String, Fleet> fleets = fleetService.getFleetsByCompany(companyId).stream()
                .collect(Collectors.toMap(Fleet::getId, Function.identity(), (a, b) -> a));
        Fleet absentFleet = absentFleetId != null ? fleets.get(absentFleetId) : null;
        String absentFleetType = absentFleet != null ? absentFleet.getType() : null;

        List<CandidateDriver> sameFleet = new ArrayList<>();
        List<CandidateDriver> otherFleets = new ArrayList<>();

        for (Driver driver : driverRepository.findByCompanyIdAndActiveTrueAndStatus(companyId, DriverStatus.AVAILABLE)) {
            // never the unavailable driver, only active AVAILABLE drivers
            if (driver.getId().equals(absentDriverId) || !driver.isActive()
                    || driver.getStatus() != DriverStatus.AVAILABLE) {
                continue;
            }

            Fleet fleet = driver.getFleetId() != null ? fleets.get(driver.getFleetId()) : null;
            String fleetName = fleet != null ? fleet.getName() : null;

            if (absentFleetId != null && absentFleetId.equals(driver.getFleetId())) {
                sameFleet.add(new CandidateDriver(driver.getId(), driver.getName(), driver.getFleetId(),
                        fleetName, PriorityTier.SAME_FLEET));
            } else {
                boolean sameType = absentFleetType != null && fleet != null
                        && Objects.equals(absentFleetType, fleet.getType());
                otherFleets.add(new CandidateDriver(driver.getId(), driver.getName(), driver.getFleetId(),
                        fleetName, sameType ? PriorityTier.SAME_FLEET_TYPE : PriorityTier.OTHER_FLEET));
            }
        }

        List<CandidateDriver> candidates = new ArrayList<>(sameFleet);
        if (!strategy.restrictsToSameFleet() || sameFleet.size() < backfillTarget) {
            candidates.addAll(otherFleets);
        }
        candidates.sort(BY_TIER_THEN_NAME);

        log.info("👥 {} candidates for driver {} ({} same fleet, strategy {})",
                candidates.size(), absentDriverId, sameFleet.size(), strategy);
        return candidates;
    }
}
