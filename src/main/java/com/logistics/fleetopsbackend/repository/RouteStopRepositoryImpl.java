package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

@RequiredArgsConstructor
public class RouteStopRepositoryImpl implements RouteStopRepositoryCustom {

    private static final Set<StopStatus> MOVABLE = EnumSet.of(StopStatus.PENDING, StopStatus.IN_PROGRESS);

    private final MongoTemplate mongoTemplate;

    @Override
    public long reassignOwnedStops(String companyId, String routeId, String vehicleId,
                                   String fromDriverId, String toDriverId,
                                   Collection<String> stopIds, String reassignmentId, LocalDateTime updatedAt) {
        // The driverId and status conditions are the ownership guard: stops taken
        // by a concurrent execution or finished in the meantime do not match.
        Query query = new Query(Criteria.where("_id").in(stopIds)
                .and("companyId").is(companyId)
                .and("routeId").is(routeId)
                .and("vehicleId").is(vehicleId)
                .and("driverId").is(fromDriverId)
                .and("status").in(MOVABLE));

        Update update = new Update()
                .set("driverId", toDriverId)
                .set("reassignmentId", reassignmentId)
                .set("updatedAt", updatedAt);

        UpdateResult result = mongoTemplate.updateMulti(query, update, RouteStop.class);
        return result.getModifiedCount();
    }

    @Override
    public boolean restoreStopOwner(String companyId, String stopId, String currentDriverId,
                                    String originalDriverId, String reassignmentId, LocalDateTime updatedAt) {
        Query query = new Query(Criteria.where("_id").is(stopId)
                .and("companyId").is(companyId)
                .and("driverId").is(currentDriverId)
                .and("reassignmentId").is(reassignmentId));

        Update update = new Update()
                .set("driverId", originalDriverId)
                .unset("reassignmentId")
                .set("updatedAt", updatedAt);

        return mongoTemplate.updateFirst(query, update, RouteStop.class).getModifiedCount() == 1;
    }
}
