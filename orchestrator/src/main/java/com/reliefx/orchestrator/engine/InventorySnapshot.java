package com.reliefx.orchestrator.engine;

import java.time.Instant;
import java.util.Map;

/**
 * Units available per resource type at the moment the snapshot was taken.
 */
public record InventorySnapshot(Map<String, Integer> stock, Instant takenAt) {

    public InventorySnapshot {
        stock = Map.copyOf(stock);
    }

    public int available(String resourceType) {
        return stock.getOrDefault(resourceType, 0);
    }
}
