package com.logistics.fleetopsbackend.model;

public enum StopStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    /**
     * Only open stops can change owner.
     */
    public boolean isOpen() {
        return this == PENDING || this == IN_PROGRESS;
    }
}
