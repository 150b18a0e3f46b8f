package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.Driver;
import com.logistics.fleetopsbackend.model.DriverStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DriverRepository extends MongoRepository<Driver, String>, DriverRepositoryCustom {

    Optional<Driver> findByIdAndCompanyId(String id, String companyId);

    List<Driver> findByCompanyIdAndIdIn(String companyId, Collection<String> ids);

    List<Driver> findByCompanyIdAndActiveTrueAndStatus(String companyId, DriverStatus status);

    long countByCompanyIdAndStatus(String companyId, DriverStatus status);
}
