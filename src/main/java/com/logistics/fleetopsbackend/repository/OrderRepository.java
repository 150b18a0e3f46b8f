package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.Order;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface OrderRepository extends MongoRepository<Order, String> {
    List<Order> findByCompanyIdAndIdIn(String companyId, Collection<String> ids);
}
