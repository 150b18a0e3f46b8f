package com.logistics.fleetopsbackend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Audit record of one completed reassignment execution.
 * Append-only: written once by the executor, never updated or deleted.
 */
@Value
@Builder
@Document(collection = "reassignment_history")
@CompoundIndexes({
    @CompoundIndex(name = "company_time_idx", def = "{'companyId': 1, 'executedAt': -1}"),
    @CompoundIndex(name = "company_driver_time_idx", def = "{'companyId': 1, 'absentDriverId': 1, 'executedAt': -1}")
})
public class ReassignmentHistory {

    @Id
    @With
    String id;

    String companyId;
    String jobId;

    String absentDriverId;
    String absentDriverName;

    List<String> routeIds;
    List<String> vehicleIds;

    @Singular
    List<ReassignmentDetail> reassignments;

    String reason;
    String executedBy;
    LocalDateTime executedAt;

    public int totalStopCount() {
        return reassignments.stream().mapToInt(ReassignmentDetail::getStopCount).sum();
    }

    @Value
    @Builder
    public static class ReassignmentDetail {
        String driverId;
        String driverName;
        String routeId;
        String vehicleId;
        List<String> stopIds;
        int stopCount;
    }
}
