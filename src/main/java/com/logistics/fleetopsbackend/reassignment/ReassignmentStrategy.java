package com.logistics.fleetopsbackend.reassignment;

/**
 * How replacement candidates are gathered. Always passed per call.
 */
public enum ReassignmentStrategy {
    SAME_FLEET,          // Same fleet first, other fleets only to fill the limit
    ANY_FLEET,           // Every fleet
    BALANCED_WORKLOAD,   // Every fleet, spread stops across drivers
    CONSOLIDATE;         // Every fleet, one driver takes everything

    public boolean restrictsToSameFleet() {
        return this == SAME_FLEET;
    }
}
