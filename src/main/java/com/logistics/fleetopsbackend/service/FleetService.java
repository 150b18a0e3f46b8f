package com.logistics.fleetopsbackend.service;

import com.logistics.fleetopsbackend.model.Fleet;
import com.logistics.fleetopsbackend.repository.FleetRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class FleetService {

    private final FleetRepository fleetRepository;

    @Cacheable(value = "fleets", key = "#companyId")
    public List<Fleet> getFleetsByCompany(String companyId) {
        return fleetRepository.findByCompanyId(companyId);
    }
}
