package com.logistics.fleetopsbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.HashSet;
import java.util.Set;

/**
 * Delivery order. Read-only for the reassignment engine: only its load and
 * required skills are used.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "orders")
public class Order {

    @Id
    private String id;

    @Indexed
    private String companyId;

    private String trackingId;

    private Double weightRequired;
    private Double volumeRequired;

    // Skill ids
    private Set<String> requiredSkills = new HashSet<>();

    public double weightOrZero() {
        return weightRequired != null ? weightRequired : 0.0;
    }

    public double volumeOrZero() {
        return volumeRequired != null ? volumeRequired : 0.0;
    }

    public Set<String> getRequiredSkills() {
        return requiredSkills != null ? requiredSkills : new HashSet<>();
    }
}
