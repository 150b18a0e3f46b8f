package com.logistics.fleetopsbackend.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum DriverStatus {
    AVAILABLE,    // Ready to take work
    ASSIGNED,     // Has a planned route, not yet started
    IN_ROUTE,     // Driving a route
    ON_PAUSE,     // Break during a route
    COMPLETED,    // Finished the day's route
    UNAVAILABLE,  // Out of the candidate pool
    ABSENT;       // Reported absent, work still attached

    private static final Map<DriverStatus, Set<DriverStatus>> TRANSITIONS = new EnumMap<>(DriverStatus.class);

    static {
        TRANSITIONS.put(AVAILABLE, EnumSet.of(ASSIGNED, IN_ROUTE, ON_PAUSE, UNAVAILABLE, ABSENT));
        TRANSITIONS.put(ASSIGNED, EnumSet.of(AVAILABLE, IN_ROUTE, UNAVAILABLE, ABSENT));
        TRANSITIONS.put(IN_ROUTE, EnumSet.of(ON_PAUSE, COMPLETED, UNAVAILABLE, ABSENT));
        TRANSITIONS.put(ON_PAUSE, EnumSet.of(IN_ROUTE, COMPLETED, UNAVAILABLE, ABSENT));
        TRANSITIONS.put(COMPLETED, EnumSet.of(AVAILABLE, ASSIGNED, IN_ROUTE, UNAVAILABLE, ABSENT));
        TRANSITIONS.put(ABSENT, EnumSet.of(AVAILABLE, UNAVAILABLE));
        TRANSITIONS.put(UNAVAILABLE, EnumSet.of(AVAILABLE));
    }

    public boolean canTransitionTo(DriverStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    /**
     * Drivers in these states must never receive work.
     */
    public boolean blocksAssignment() {
        return this == UNAVAILABLE || this == ABSENT;
    }

    /**
     * States in which a driver is considered free to absorb new stops.
     */
    public boolean isFreeForWork() {
        return this == AVAILABLE || this == COMPLETED;
    }
}
