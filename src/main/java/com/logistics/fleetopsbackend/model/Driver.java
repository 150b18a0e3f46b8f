package com.logistics.fleetopsbackend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "drivers")
@JsonIgnoreProperties(ignoreUnknown = true)
@CompoundIndexes({
    @CompoundIndex(name = "company_status_idx", def = "{'companyId': 1, 'active': 1, 'status': 1}"),
    @CompoundIndex(name = "company_fleet_idx", def = "{'companyId': 1, 'fleetId': 1}")
})
public class Driver implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String id;

    @Indexed
    private String companyId;

    private String fleetId;

    @Indexed
    private String name;

    private DriverStatus status;

    private LocalDate licenseExpiry;

    private List<DriverSkill> skills = new ArrayList<>();

    // Soft delete flag, inactive drivers are never candidates
    private boolean active;

    public List<DriverSkill> getSkills() {
        return skills != null ? skills : new ArrayList<>();
    }

    public boolean canReceiveWork() {
        return active && status != null && !status.blocksAssignment();
    }
}
