package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.ReassignmentHistory;
import org.springframework.data.repository.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Append-only store: only insert and reads are exposed.
 */
public interface ReassignmentHistoryRepository
        extends Repository<ReassignmentHistory, String>, ReassignmentHistoryRepositoryCustom {

    <S extends ReassignmentHistory> S insert(S entry);

    Optional<ReassignmentHistory> findByIdAndCompanyId(String id, String companyId);

    long countByCompanyIdAndExecutedAtAfter(String companyId, LocalDateTime since);
}
