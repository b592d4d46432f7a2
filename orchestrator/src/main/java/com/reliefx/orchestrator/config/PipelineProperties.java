package com.reliefx.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tuning knobs for the pipeline, bound from the {@code reliefx.*} keys in application.yml.
 *
 * Every field has a default so a bare configuration still starts.
 */
@ConfigurationProperties(prefix = "reliefx")
public class PipelineProperties {

    // Identifies this process in claim owners, trigger consumers and logs.
    private String instanceId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    private Intake intake = new Intake();
    private Bus bus = new Bus();
    private Engines engines = new Engines();
    private Recovery recovery = new Recovery();
    private Inventory inventory = new Inventory();

    public String getInstanceId() { return instanceId; }
    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }
    public Intake getIntake() { return intake; }
    public void setIntake(Intake intake) { this.intake = intake; }
    public Bus getBus() { return bus; }
    public void setBus(Bus bus) { this.bus = bus; }
    public Engines getEngines() { return engines; }
    public void setEngines(Engines engines) { this.engines = engines; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }
    public Inventory getInventory() { return inventory; }
    public void setInventory(Inventory inventory) { this.inventory = inventory; }

    /** Intake Router validation and publish retry. */
    public static class Intake {
        private int publishAttempts = 3;
        private Duration publishBackoff = Duration.ofMillis(200);
        // Empty means any region is accepted.
        private List<String> allowedRegions = new ArrayList<>();

        public int getPublishAttempts() { return publishAttempts; }
        public void setPublishAttempts(int publishAttempts) { this.publishAttempts = publishAttempts; }
        public Duration getPublishBackoff() { return publishBackoff; }
        public void setPublishBackoff(Duration publishBackoff) { this.publishBackoff = publishBackoff; }
        public List<String> getAllowedRegions() { return allowedRegions; }
        public void setAllowedRegions(List<String> allowedRegions) { this.allowedRegions = allowedRegions; }
    }

    /** Trigger Bus consumer settings. */
    public static class Bus {
        private int consumerThreads = 4;
        private int maxDeliveries = 6;
        private Duration lease = Duration.ofMinutes(10);
        private Duration initialBackoff = Duration.ofSeconds(5);
        private Duration maxBackoff = Duration.ofMinutes(5);

        public int getConsumerThreads() { return consumerThreads; }
        public void setConsumerThreads(int consumerThreads) { this.consumerThreads = consumerThreads; }
        public int getMaxDeliveries() { return maxDeliveries; }
        public void setMaxDeliveries(int maxDeliveries) { this.maxDeliveries = maxDeliveries; }
        public Duration getLease() { return lease; }
        public void setLease(Duration lease) { this.lease = lease; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    /** External analysis engines. */
    public static class Engines {
        private Engine analysis = new Engine("http://localhost:8091", Duration.ofMinutes(5));
        private Engine planning = new Engine("http://localhost:8092", Duration.ofMinutes(3));

        public Engine getAnalysis() { return analysis; }
        public void setAnalysis(Engine analysis) { this.analysis = analysis; }
        public Engine getPlanning() { return planning; }
        public void setPlanning(Engine planning) { this.planning = planning; }
    }

    public static class Engine {
        private String baseUrl;
        private Duration timeout;

        public Engine() {}

        public Engine(String baseUrl, Duration timeout) {
            this.baseUrl = baseUrl;
            this.timeout = timeout;
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    /** Background sweeps. staleClaimAfter must exceed both engine timeouts. */
    public static class Recovery {
        private Duration staleClaimAfter = Duration.ofMinutes(20);
        private Duration undispatchedAfter = Duration.ofMinutes(2);

        public Duration getStaleClaimAfter() { return staleClaimAfter; }
        public void setStaleClaimAfter(Duration staleClaimAfter) { this.staleClaimAfter = staleClaimAfter; }
        public Duration getUndispatchedAfter() { return undispatchedAfter; }
        public void setUndispatchedAfter(Duration undispatchedAfter) { this.undispatchedAfter = undispatchedAfter; }
    }

    /** Stock used by the configured inventory source. */
    public static class Inventory {
        private Map<String, Integer> stock = new LinkedHashMap<>();

        public Map<String, Integer> getStock() { return stock; }
        public void setStock(Map<String, Integer> stock) { this.stock = stock; }
    }
}
