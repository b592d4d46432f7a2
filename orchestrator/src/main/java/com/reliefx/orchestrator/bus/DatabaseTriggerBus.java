package com.reliefx.orchestrator.bus;

import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerTopic;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Trigger Bus backed by the triggers table.
 *
 * The DB IS the queue: publish is an INSERT, and the consumer loop leases rows
 * with SELECT FOR UPDATE SKIP LOCKED. Every instance polls; whichever instance
 * leases a trigger runs the subscribed handler on its consumer pool.
 *
 * Delivery is at-least-once. A handler exception, a lease that expires before
 * the ack, or a crash between handler completion and ack all lead to the same
 * message being delivered again.
 */
@Component
@EnableScheduling
public class DatabaseTriggerBus implements TriggerBus {

    private static final Logger log = LoggerFactory.getLogger(DatabaseTriggerBus.class);

    private final TriggerLedger                    ledger;
    private final String                           consumerId;
    private final ExecutorService                  consumers;
    // One permit per consumer thread; we never lease more than we can run.
    private final Semaphore                        capacity;
    private final Map<TriggerTopic, TriggerHandler> handlers = new ConcurrentHashMap<>();

    public DatabaseTriggerBus(TriggerLedger ledger, PipelineProperties properties) {
        this.ledger     = ledger;
        this.consumerId = properties.getInstanceId();
        int threads     = properties.getBus().getConsumerThreads();
        this.consumers  = Executors.newFixedThreadPool(threads);
        this.capacity   = new Semaphore(threads);
    }

    // ------------------------------------------------------------------
    // TriggerBus
    // ------------------------------------------------------------------

    @Override
    public UUID publish(TriggerTopic topic, String requestId) {
        try {
            return ledger.append(topic, requestId).getId();
        } catch (DataAccessException | TransactionException e) {
            throw new TriggerPublishException(topic, requestId, e);
        }
    }

    @Override
    public void subscribe(TriggerHandler handler) {
        TriggerHandler previous = handlers.putIfAbsent(handler.topic(), handler);
        if (previous != null && previous != handler) {
            throw new IllegalStateException("Topic " + handler.topic() + " already has a handler");
        }
        log.info("Subscribed {} to topic {}", handler.getClass().getSimpleName(), handler.topic());
    }

    // ------------------------------------------------------------------
    // Consumer loop
    // ------------------------------------------------------------------

    /**
     * Tick: lease as many deliverable triggers as there are idle consumer
     * threads, and hand each to its topic's handler.
     */
    @Scheduled(fixedDelayString = "${reliefx.bus.poll-interval-ms:500}")
    public void poll() {
        if (handlers.isEmpty()) return;

        int free = capacity.availablePermits();
        if (free == 0) return;

        List<Trigger> leased = ledger.lease(free, consumerId);
        for (Trigger trigger : leased) {
            capacity.acquireUninterruptibly();
            TriggerMessage message = TriggerMessage.from(trigger);
            consumers.submit(() -> {
                try {
                    deliver(message);
                } finally {
                    capacity.release();
                }
            });
        }
    }

    /** Return expired leases to the queue. */
    @Scheduled(fixedDelayString = "${reliefx.bus.lease-sweep-interval-ms:30000}")
    public void sweepExpiredLeases() {
        int recovered = ledger.recoverExpiredLeases();
        if (recovered > 0) {
            log.warn("Recovered {} trigger(s) with expired leases", recovered);
        }
    }

    /**
     * Run the handler for one message and settle it: ack on success, retry or
     * dead-letter on any exception.
     */
    void deliver(TriggerMessage message) {
        MDC.put("messageId", message.messageId().toString());
        MDC.put("requestId", message.requestId());
        MDC.put("delivery",  String.valueOf(message.delivery()));
        try {
            TriggerHandler handler = handlers.get(message.topic());
            if (handler == null) {
                ledger.retryOrDeadLetter(message, consumerId, "No handler subscribed to " + message.topic());
                return;
            }
            try {
                handler.handle(message);
            } catch (Exception e) {
                log.warn("Handler for {} failed on request {}: {}",
                        message.topic(), message.requestId(), e.toString());
                ledger.retryOrDeadLetter(message, consumerId, e.toString());
                return;
            }
            ledger.ack(message, consumerId);
        } catch (RuntimeException e) {
            // Settling failed (store unavailable); the lease will expire and the
            // sweep will make the trigger deliverable again.
            log.error("Could not settle trigger {} for request {}: {}",
                    message.messageId(), message.requestId(), e.getMessage(), e);
        } finally {
            MDC.remove("messageId");
            MDC.remove("requestId");
            MDC.remove("delivery");
        }
    }

    @PreDestroy
    void shutdown() {
        consumers.shutdownNow();
    }
}
