package com.reliefx.orchestrator.store;

import com.reliefx.orchestrator.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of committed State Store writes.
 *
 * JpaStateStore publishes a {@link RecordChange} as a Spring application event
 * inside its transaction; this listener runs only after the transaction commits,
 * so subscribers never observe a write that was rolled back.
 *
 * Observers in other processes poll GET /requests/{id} instead.
 */
@Component
public class ChangeFeed {

    private static final Logger log = LoggerFactory.getLogger(ChangeFeed.class);

    private final Map<RecordType, List<Consumer<RecordChange>>> listeners = new EnumMap<>(RecordType.class);

    public ChangeFeed() {
        for (RecordType type : RecordType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public Subscription subscribe(RecordType type, Consumer<RecordChange> listener) {
        List<Consumer<RecordChange>> forType = listeners.get(type);
        forType.add(listener);
        return () -> forType.remove(listener);
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onChange(RecordChange change) {
        for (Consumer<RecordChange> listener : listeners.get(change.type())) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                // A broken observer must not fail the pipeline write that triggered it.
                log.warn("Change listener failed for {} {}: {}",
                        change.type(), change.requestId(), e.getMessage());
            }
        }
    }

    int listenerCount(RecordType type) {
        return listeners.get(type).size();
    }
}
