package com.logistics.fleetopsbackend.reassignment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Affinity of a candidate to the unavailable driver. Declaration order is rank order.
 */
public enum PriorityTier {
    SAME_FLEET(1),
    SAME_FLEET_TYPE(2),
    OTHER_FLEET(3);

    private final int rank;

    PriorityTier(int rank) {
        this.rank = rank;
    }

    @JsonValue
    public int getRank() {
        return rank;
    }

    @JsonCreator
    public static PriorityTier fromRank(int rank) {
        for (PriorityTier tier : values()) {
            if (tier.rank == rank) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown priority tier: " + rank);
    }
}
