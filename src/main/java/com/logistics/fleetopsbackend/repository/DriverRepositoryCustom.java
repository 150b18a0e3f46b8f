package com.logistics.fleetopsbackend.repository;

import com.logistics.fleetopsbackend.model.DriverStatus;

public interface DriverRepositoryCustom {

    /**
     * Moves a driver from {@code expected} to {@code target} only if the stored
     * status still equals {@code expected}.
     *
     * @return true when the document was updated
     */
    boolean transitionStatus(String companyId, String driverId, DriverStatus expected, DriverStatus target);
}
