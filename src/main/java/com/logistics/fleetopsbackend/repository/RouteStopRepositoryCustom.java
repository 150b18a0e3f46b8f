package com.logistics.fleetopsbackend.repository;

import java.time.LocalDateTime;
import java.util.Collection;

public interface RouteStopRepositoryCustom {

    /**
     * Hands the given stops of one route/vehicle to {@code toDriverId}, touching
     * only the ones still owned by {@code fromDriverId} and still PENDING or
     * IN_PROGRESS. Moved stops are stamped with {@code reassignmentId}. Status
     * and sequence are left as they are.
     *
     * @return number of stops actually moved
     */
    long reassignOwnedStops(String companyId, String routeId, String vehicleId,
                            String fromDriverId, String toDriverId,
                            Collection<String> stopIds, String reassignmentId, LocalDateTime updatedAt);

    /**
     * Gives one stop back to {@code originalDriverId} if it is currently owned by
     * {@code currentDriverId} and was moved there by {@code reassignmentId}.
     *
     * @return true when the stop was restored
     */
    boolean restoreStopOwner(String companyId, String stopId, String currentDriverId,
                             String originalDriverId, String reassignmentId, LocalDateTime updatedAt);
}
