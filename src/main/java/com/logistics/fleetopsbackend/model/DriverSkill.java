package com.logistics.fleetopsbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * A skill held by a driver. Embedded in the driver document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DriverSkill implements Serializable {
    private static final long serialVersionUID = 1L;

    private String skillId;
    private LocalDateTime expiresAt;
    private boolean active = true;

    public boolean isExpiredAt(LocalDateTime instant) {
        return expiresAt != null && expiresAt.isBefore(instant);
    }
}
