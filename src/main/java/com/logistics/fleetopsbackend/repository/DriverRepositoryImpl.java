package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.Driver;
import com.logistics.fleetopsbackend.model.DriverStatus;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

@RequiredArgsConstructor
public class DriverRepositoryImpl implements DriverRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean transitionStatus(String companyId, String driverId, DriverStatus expected, DriverStatus target) {
        Query query = new Query(Criteria.where("_id").is(driverId)
                .and("companyId").is(companyId)
                .and("status").is(expected));
        UpdateResult result = mongoTemplate.updateFirst(query, new Update().set("status", target), Driver.class);
        return result.getModifiedCount() == 1;
    }
}
