package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.config.ReassignmentProperties;
import com.logistics.fleetopsbackend.dto.HistoryEntryView;
import com.logistics.fleetopsbackend.dto.HistoryEntryView.ReplacementDriverSummary;
import com.logistics.fleetopsbackend.dto.ReassignmentStatusSummary;
import com.logistics.fleetopsbackend.model.DriverStatus;
import com.logistics.fleetopsbackend.model.ReassignmentHistory;
import com.logistics.fleetopsbackend.repository.DriverRepository;
import com.logistics.fleetopsbackend.repository.ReassignmentHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of the reassignment history. No side effects.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReassignmentHistoryService {

    private final ReassignmentHistoryRepository historyRepository;
    private final DriverRepository driverRepository;
    private final ReassignmentProperties properties;
    private final Clock clock;

    /**
     * Newest first. A non-positive limit means the default page size; limits
     * above the maximum are capped.
     */
    public List<HistoryEntryView> getHistory(String companyId, String jobId, String driverId, int limit, long offset) {
        int pageSize = limit <= 0 ? properties.getDefaultHistoryLimit() : Math.min(limit, properties.getMaxHistoryLimit());
        long skip = Math.max(0, offset);

        List<ReassignmentHistory> page = historyRepository.findPage(companyId, jobId, driverId, pageSize, skip);
        log.debug("📜 {} history entries for company {} (job {}, driver {})", page.size(), companyId, jobId, driverId);

        return page.stream().map(ReassignmentHistoryService::toView).collect(Collectors.toList());
    }

    public ReassignmentStatusSummary getStatusSummary(String companyId) {
        long absent = driverRepository.countByCompanyIdAndStatus(companyId, DriverStatus.ABSENT);
        long recent = historyRepository.countByCompanyIdAndExecutedAtAfter(companyId,
                LocalDateTime.now(clock).minusHours(24));
        return new ReassignmentStatusSummary(absent, recent);
    }

    static HistoryEntryView toView(ReassignmentHistory entry) {
        List<ReplacementDriverSummary> drivers = entry.getReassignments().stream()
                .map(d -> new ReplacementDriverSummary(d.getDriverId(), d.getDriverName(), d.getRouteId(), d.getStopCount()))
                .collect(Collectors.toList());

        return HistoryEntryView.builder()
                .id(entry.getId())
                .jobId(entry.getJobId())
                .absentDriverId(entry.getAbsentDriverId())
                .absentDriverName(entry.getAbsentDriverName())
                .replacementDrivers(drivers)
                .routeIds(entry.getRouteIds())
                .vehicleIds(entry.getVehicleIds())
                .totalStops(entry.totalStopCount())
                .reason(entry.getReason())
                .createdAt(entry.getExecutedAt())
                .createdBy(entry.getExecutedBy())
                .build();
    }
}
