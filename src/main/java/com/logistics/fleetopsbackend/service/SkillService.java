package com.logistics.fleetopsbackend.service;

import com.logistics.fleetopsbackend.model.Skill;
import com.logistics.fleetopsbackend.repository.SkillRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class SkillService {

    private final SkillRepository skillRepository;

    // Skill definitions change rarely, cached per tenant
    @Cacheable(value = "skills", key = "#companyId")
    public List<Skill> getSkillsByCompany(String companyId) {
        return skillRepository.findByCompanyId(companyId);
    }
}
