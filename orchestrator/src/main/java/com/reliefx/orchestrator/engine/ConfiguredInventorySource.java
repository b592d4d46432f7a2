package com.reliefx.orchestrator.engine;

import com.reliefx.orchestrator.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Inventory read from {@code reliefx.inventory.stock}.
 *
 * Stands in for a real stock system; replace the bean to read live levels.
 */
@Component
public class ConfiguredInventorySource implements InventorySource {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredInventorySource.class);

    private final PipelineProperties.Inventory config;

    public ConfiguredInventorySource(PipelineProperties properties) {
        this.config = properties.getInventory();
    }

    @Override
    public InventorySnapshot snapshot() {
        if (config.getStock().isEmpty()) {
            log.warn("reliefx.inventory.stock is empty; every plan will be rejected as over-allocated");
        }
        return new InventorySnapshot(config.getStock(), Instant.now());
    }
}
