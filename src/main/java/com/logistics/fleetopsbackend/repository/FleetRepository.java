package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.Fleet;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FleetRepository extends MongoRepository<Fleet, String> {
    List<Fleet> findByCompanyId(String companyId);
}
