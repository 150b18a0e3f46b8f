package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.Vehicle;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface VehicleRepository extends MongoRepository<Vehicle, String> {
    List<Vehicle> findByCompanyIdAndIdIn(String companyId, Collection<String> ids);
}
