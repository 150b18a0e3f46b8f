package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.ReassignmentHistory;

import java.util.List;

public interface ReassignmentHistoryRepositoryCustom {

    /**
     * Newest first. {@code jobId} and {@code absentDriverId} are optional filters.
     */
    List<ReassignmentHistory> findPage(String companyId, String jobId, String absentDriverId, int limit, long offset);
}
