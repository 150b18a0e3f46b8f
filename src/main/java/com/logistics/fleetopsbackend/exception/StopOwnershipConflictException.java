package com.logistics.fleetopsbackend.exception;

import lombok.Getter;

/**
 * The guarded stop update moved fewer stops than were owned when the execution
 * was validated: another execution got there first.
 */
@Getter
public class StopOwnershipConflictException extends RuntimeException {

    private final String routeId;
    private final int expected;
    private final long moved;

    public StopOwnershipConflictException(String routeId, int expected, long moved) {
        super("Route " + routeId + ": expected to move " + expected + " stops but moved " + moved
                + ", stops were reassigned concurrently");
        this.routeId = routeId;
        this.expected = expected;
        this.moved = moved;
    }
}
