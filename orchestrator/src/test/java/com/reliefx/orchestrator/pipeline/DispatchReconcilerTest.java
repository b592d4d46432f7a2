package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.bus.DatabaseTriggerBus;
import com.reliefx.orchestrator.bus.TriggerLedger;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.model.RescueRequest;
import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerTopic;
import com.reliefx.orchestrator.support.Fixtures;
import com.reliefx.orchestrator.support.InMemoryStateStore;
import com.reliefx.orchestrator.support.InMemoryTriggerBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DispatchReconcilerTest {

    InMemoryStateStore store;
    InMemoryTriggerBus bus;
    DispatchReconciler reconciler;
    Instant            now = Instant.now();

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        bus   = new InMemoryTriggerBus();
        reconciler = new DispatchReconciler(store, bus, Fixtures.properties(), Clock.fixed(now, ZoneOffset.UTC));
    }

    private void storeRequest(String id, Duration age, boolean dispatched) {
        RescueRequest r = Fixtures.request(id);
        r.setCreatedAt(now.minus(age));
        store.createRequest(r);
        if (dispatched) store.markRequestDispatched(id);
    }

    @Test
    void redispatch_republishesOnlyOldUndispatchedRequests() {
        storeRequest("old-stuck", Duration.ofMinutes(10), false);
        storeRequest("new-stuck", Duration.ofSeconds(10), false);   // router may still be retrying
        storeRequest("old-fine",  Duration.ofMinutes(10), true);

        assertThat(reconciler.redispatch()).isEqualTo(1);

        assertThat(bus.published(TriggerTopic.DAMAGE_ANALYSIS))
                .singleElement()
                .satisfies(m -> assertThat(m.requestId()).isEqualTo("old-stuck"));
        assertThat(store.findRequest("old-stuck").orElseThrow().isDispatched()).isTrue();
        assertThat(reconciler.redispatch()).isZero();
    }

    @Test
    void redispatch_busStillDown_leftForNextSweep() {
        storeRequest("old-stuck", Duration.ofMinutes(10), false);
        bus.failNextPublishes(1);

        assertThat(reconciler.redispatch()).isZero();
        assertThat(store.findRequest("old-stuck").orElseThrow().isDispatched()).isFalse();

        assertThat(reconciler.redispatch()).isEqualTo(1);
    }

    @Test
    void redispatch_ledgerCannotOpenTransaction_sweepContinuesWithOtherRequests() {
        storeRequest("stuck-a", Duration.ofMinutes(10), false);
        storeRequest("stuck-b", Duration.ofMinutes(10), false);
        TriggerLedger ledger = mock(TriggerLedger.class);
        when(ledger.append(TriggerTopic.DAMAGE_ANALYSIS, "stuck-a"))
                .thenThrow(new CannotCreateTransactionException("pool exhausted"));
        when(ledger.append(TriggerTopic.DAMAGE_ANALYSIS, "stuck-b"))
                .thenReturn(new Trigger(TriggerTopic.DAMAGE_ANALYSIS, "stuck-b"));
        PipelineProperties properties = Fixtures.properties();
        DispatchReconciler dbReconciler = new DispatchReconciler(store, new DatabaseTriggerBus(ledger, properties),
                properties, Clock.fixed(now, ZoneOffset.UTC));

        assertThat(dbReconciler.redispatch()).isEqualTo(1);

        assertThat(store.findRequest("stuck-a").orElseThrow().isDispatched()).isFalse();
        assertThat(store.findRequest("stuck-b").orElseThrow().isDispatched()).isTrue();
    }
}
