package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.Skill;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SkillRepository extends MongoRepository<Skill, String> {
    List<Skill> findByCompanyId(String companyId);
}
