package com.reliefx.orchestrator.config;

import com.reliefx.orchestrator.bus.TriggerBus;
import com.reliefx.orchestrator.bus.TriggerHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Subscribes every stage worker to the Trigger Bus once the context is up.
 *
 * Subscribing after startup means no trigger is leased before all handlers
 * and their dependencies exist.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    ApplicationRunner subscribeStageWorkers(TriggerBus bus, List<TriggerHandler> handlers,
                                            PipelineProperties properties) {
        return args -> {
            handlers.forEach(bus::subscribe);
            log.info("Instance '{}' consuming {} topic(s)", properties.getInstanceId(), handlers.size());
        };
    }
}
