package com.reliefx.orchestrator.engine;

/**
 * Where the logistics stage reads available relief stock from.
 */
public interface InventorySource {

    InventorySnapshot snapshot();
}
