package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.ReassignmentHistory;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

@RequiredArgsConstructor
public class ReassignmentHistoryRepositoryImpl implements ReassignmentHistoryRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<ReassignmentHistory> findPage(String companyId, String jobId, String absentDriverId,
                                              int limit, long offset) {
        Criteria criteria = Criteria.where("companyId").is(companyId);
        if (jobId != null) {
            criteria = criteria.and("jobId").is(jobId);
        }
        if (absentDriverId != null) {
            criteria = criteria.and("absentDriverId").is(absentDriverId);
        }

        Query query = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "executedAt"))
                .skip(offset)
                .limit(limit);

        return mongoTemplate.find(query, ReassignmentHistory.class);
    }
}
