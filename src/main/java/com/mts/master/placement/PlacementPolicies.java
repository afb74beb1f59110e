package com.mts.master.placement;

import com.mts.common.config.SystemConfig;

public final class PlacementPolicies {

    private PlacementPolicies() {
    }

    public static PlacementPolicy fromName(String name) {
        if (name == null || SystemConfig.PLACEMENT_LEAST_LOADED.equalsIgnoreCase(name)) {
            return new LeastLoadedPlacementPolicy();
        }
        if (SystemConfig.PLACEMENT_ROUND_ROBIN.equalsIgnoreCase(name)) {
            return new RoundRobinPlacementPolicy();
        }
        throw new IllegalArgumentException("Unknown placement policy: " + name);
    }
}
