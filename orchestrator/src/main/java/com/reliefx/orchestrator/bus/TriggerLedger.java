package com.reliefx.orchestrator.bus;

import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerState;
import com.reliefx.orchestrator.model.TriggerTopic;
import com.reliefx.orchestrator.repository.TriggerRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Transactional operations on the triggers table.
 *
 * Kept separate from {@link DatabaseTriggerBus} so every call goes through the
 * Spring transaction proxy: the lease (SELECT FOR UPDATE SKIP LOCKED + UPDATE)
 * must commit atomically before the handler runs.
 */
@Service
public class TriggerLedger {

    private static final Logger log = LoggerFactory.getLogger(TriggerLedger.class);

    private final TriggerRepository            triggerRepo;
    private final PipelineProperties.Bus       config;
    private final MeterRegistry                meterRegistry;

    public TriggerLedger(TriggerRepository triggerRepo,
                         PipelineProperties properties,
                         MeterRegistry meterRegistry) {
        this.triggerRepo   = triggerRepo;
        this.config        = properties.getBus();
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Producer side
    // ------------------------------------------------------------------

    /** Persist a new PENDING trigger; durable once this method returns. */
    @Transactional
    public Trigger append(TriggerTopic topic, String requestId) {
        Trigger saved = triggerRepo.save(new Trigger(topic, requestId));
        meterRegistry.counter("reliefx.bus.published", "topic", topic.name()).increment();
        log.info("Enqueued {} trigger {} for request {}", topic, saved.getId(), requestId);
        return saved;
    }

    // ------------------------------------------------------------------
    // Consumer side
    // ------------------------------------------------------------------

    /**
     * Lease up to {@code max} deliverable triggers for {@code consumer}.
     *
     * Uses SELECT FOR UPDATE SKIP LOCKED so any number of instances can poll
     * concurrently without leasing the same trigger twice.
     */
    @Transactional
    public List<Trigger> lease(int max, String consumer) {
        if (max <= 0) return List.of();
        Instant now = Instant.now();
        List<Trigger> leased = triggerRepo.findDeliverable(now, PageRequest.of(0, max));
        for (Trigger trigger : leased) {
            trigger.setState(TriggerState.IN_FLIGHT);
            trigger.setConsumer(consumer);
            trigger.setLeasedUntil(now.plus(config.getLease()));
            trigger.incrementDeliveryCount();
            triggerRepo.save(trigger);
            if (trigger.getDeliveryCount() > 1) {
                meterRegistry.counter("reliefx.bus.redeliveries", "topic", trigger.getTopic().name()).increment();
            }
        }
        return leased;
    }

    /**
     * Handler finished: the trigger will never be delivered again.
     *
     * @return false if {@code consumer} no longer holds the lease for this
     *         delivery (it expired and the trigger was requeued or re-leased)
     */
    @Transactional
    public boolean ack(TriggerMessage message, String consumer) {
        Optional<Trigger> held = leaseHeldBy(message, consumer);
        held.ifPresent(trigger -> {
            trigger.setState(TriggerState.ACKED);
            trigger.setAckedAt(Instant.now());
            trigger.setLeasedUntil(null);
            triggerRepo.save(trigger);
        });
        return held.isPresent();
    }

    /**
     * Handler failed. Schedule a redelivery with exponential backoff, or move the
     * trigger to DEAD once it has been delivered {@code maxDeliveries} times.
     *
     * @return the state the trigger ended up in, empty if {@code consumer} no
     *         longer holds the lease for this delivery
     */
    @Transactional
    public Optional<TriggerState> retryOrDeadLetter(TriggerMessage message, String consumer, String error) {
        return leaseHeldBy(message, consumer).map(trigger -> requeueOrBury(trigger, error));
    }

    /**
     * Return IN_FLIGHT triggers whose lease expired to PENDING.
     *
     * A consumer that crashed or hung never acks; its triggers become visible
     * again here. The next lease counts as a new delivery.
     */
    @Transactional
    public int recoverExpiredLeases() {
        List<Trigger> expired = triggerRepo.findByStateAndLeasedUntilBefore(TriggerState.IN_FLIGHT, Instant.now());
        for (Trigger trigger : expired) {
            log.warn("Lease expired for trigger {} ({} for request {}, consumer={})",
                    trigger.getId(), trigger.getTopic(), trigger.getRequestId(), trigger.getConsumer());
            requeueOrBury(trigger, "Lease expired while held by " + trigger.getConsumer());
        }
        return expired.size();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<Trigger> findByState(TriggerState state) {
        return triggerRepo.findTop100ByStateOrderByUpdatedAtDesc(state);
    }

    @Transactional(readOnly = true)
    public List<Trigger> findByRequest(String requestId) {
        return triggerRepo.findByRequestIdOrderByCreatedAtAsc(requestId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * The locked trigger row, only while it is still IN_FLIGHT under this
     * consumer for this delivery. A re-lease bumps the delivery count, so a
     * stale consumer on the same instance does not match either.
     */
    private Optional<Trigger> leaseHeldBy(TriggerMessage message, String consumer) {
        Optional<Trigger> held = triggerRepo.lockById(message.messageId())
                .filter(t -> t.getState() == TriggerState.IN_FLIGHT
                        && consumer.equals(t.getConsumer())
                        && t.getDeliveryCount() == message.delivery());
        if (held.isEmpty()) {
            log.warn("Lease on trigger {} (delivery {}) no longer held by {}; not settling",
                    message.messageId(), message.delivery(), consumer);
        }
        return held;
    }

    private TriggerState requeueOrBury(Trigger trigger, String error) {
        trigger.setLastError(error);
        trigger.setLeasedUntil(null);
        if (trigger.getDeliveryCount() >= config.getMaxDeliveries()) {
            trigger.setState(TriggerState.DEAD);
            meterRegistry.counter("reliefx.bus.dead_letters", "topic", trigger.getTopic().name()).increment();
            log.error("Trigger {} ({} for request {}) dead-lettered after {} deliveries: {}",
                    trigger.getId(), trigger.getTopic(), trigger.getRequestId(),
                    trigger.getDeliveryCount(), error);
        } else {
            Duration delay = backoff(trigger.getDeliveryCount());
            trigger.setState(TriggerState.PENDING);
            trigger.setAvailableAt(Instant.now().plus(delay));
            log.warn("Trigger {} ({} for request {}) will be redelivered in {} (delivery {}/{}): {}",
                    trigger.getId(), trigger.getTopic(), trigger.getRequestId(), delay,
                    trigger.getDeliveryCount(), config.getMaxDeliveries(), error);
        }
        triggerRepo.save(trigger);
        return trigger.getState();
    }

    /** initial × 2^(delivery-1), capped at maxBackoff. */
    Duration backoff(int deliveryCount) {
        int exponent = Math.max(0, Math.min(deliveryCount - 1, 20));
        Duration delay = config.getInitialBackoff().multipliedBy(1L << exponent);
        return delay.compareTo(config.getMaxBackoff()) > 0 ? config.getMaxBackoff() : delay;
    }
}
