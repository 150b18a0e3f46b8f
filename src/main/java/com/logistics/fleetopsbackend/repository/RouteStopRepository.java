package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RouteStopRepository extends MongoRepository<RouteStop, String>, RouteStopRepositoryCustom {

    List<RouteStop> findByCompanyIdAndDriverIdAndStatusIn(String companyId, String driverId,
                                                          Collection<StopStatus> statuses);

    List<RouteStop> findByCompanyIdAndJobIdAndDriverIdAndStatusIn(String companyId, String jobId, String driverId,
                                                                  Collection<StopStatus> statuses);

    List<RouteStop> findByCompanyIdAndDriverId(String companyId, String driverId);

    List<RouteStop> findByCompanyIdAndIdIn(String companyId, Collection<String> ids);

    // Snapshot of the stops an operation will move
    List<RouteStop> findByCompanyIdAndRouteIdAndVehicleIdAndDriverIdAndIdIn(String companyId, String routeId,
                                                                             String vehicleId, String driverId,
                                                                             Collection<String> ids);

    long countByCompanyIdAndDriverIdAndStatusIn(String companyId, String driverId, Collection<StopStatus> statuses);

    boolean existsByCompanyIdAndDriverIdAndStatus(String companyId, String driverId, StopStatus status);
}
