package com.reliefx.orchestrator.bus;

import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.model.Trigger;
import com.reliefx.orchestrator.model.TriggerState;
import com.reliefx.orchestrator.model.TriggerTopic;
import com.reliefx.orchestrator.repository.TriggerRepository;
import com.reliefx.orchestrator.support.Fixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TriggerLedgerTest {

    static final UUID ID = UUID.randomUUID();

    @Mock TriggerRepository triggerRepo;

    SimpleMeterRegistry meters;
    PipelineProperties  properties;
    TriggerLedger       ledger;

    @BeforeEach
    void setUp() {
        meters     = new SimpleMeterRegistry();
        properties = Fixtures.properties();
        properties.getBus().setMaxDeliveries(3);
        properties.getBus().setInitialBackoff(Duration.ofSeconds(5));
        properties.getBus().setMaxBackoff(Duration.ofSeconds(30));
        ledger     = new TriggerLedger(triggerRepo, properties, meters);
    }

    // ------------------------------------------------------------------
    // lease()
    // ------------------------------------------------------------------

    @Test
    void lease_marksInFlightAndCountsDelivery() {
        Trigger t = new Trigger(TriggerTopic.DAMAGE_ANALYSIS, "r1");
        when(triggerRepo.findDeliverable(any(Instant.class), any(Pageable.class))).thenReturn(List.of(t));

        List<Trigger> leased = ledger.lease(4, "instance-a");

        assertThat(leased).containsExactly(t);
        assertThat(t.getState()).isEqualTo(TriggerState.IN_FLIGHT);
        assertThat(t.getConsumer()).isEqualTo("instance-a");
        assertThat(t.getDeliveryCount()).isEqualTo(1);
        assertThat(t.getLeasedUntil()).isAfter(Instant.now().plus(Duration.ofMinutes(9)));
        verify(triggerRepo).save(t);
    }

    @Test
    void lease_noCapacity_doesNotQuery() {
        assertThat(ledger.lease(0, "instance-a")).isEmpty();
        verifyNoInteractions(triggerRepo);
    }

    // ------------------------------------------------------------------
    // retryOrDeadLetter()
    // ------------------------------------------------------------------

    @Test
    void retryOrDeadLetter_belowLimit_requeuedWithBackoff() {
        Trigger t = delivered(1);
        when(triggerRepo.lockById(ID)).thenReturn(Optional.of(t));

        Optional<TriggerState> state = ledger.retryOrDeadLetter(message(1), "instance-a", "damage report not ready");

        assertThat(state).contains(TriggerState.PENDING);
        assertThat(t.getLastError()).isEqualTo("damage report not ready");
        assertThat(t.getAvailableAt()).isAfter(Instant.now().plusSeconds(4));
        assertThat(t.getLeasedUntil()).isNull();
    }

    @Test
    void retryOrDeadLetter_atLimit_deadLettered() {
        Trigger t = delivered(3);
        when(triggerRepo.lockById(ID)).thenReturn(Optional.of(t));

        assertThat(ledger.retryOrDeadLetter(message(3), "instance-a", "still not ready")).contains(TriggerState.DEAD);
        assertThat(meters.counter("reliefx.bus.dead_letters", "topic", "LOGISTICS_PLANNING").count()).isEqualTo(1.0);
    }

    @Test
    void retryOrDeadLetter_releasedToAnotherDelivery_leftAlone() {
        // Lease of delivery 1 expired; the trigger was re-leased as delivery 2.
        Trigger t = delivered(2);
        when(triggerRepo.lockById(ID)).thenReturn(Optional.of(t));

        assertThat(ledger.retryOrDeadLetter(message(1), "instance-a", "slow handler")).isEmpty();
        assertThat(t.getState()).isEqualTo(TriggerState.IN_FLIGHT);
        assertThat(t.getLastError()).isNull();
        verify(triggerRepo, never()).save(any());
    }

    @Test
    void backoff_doublesAndCaps() {
        assertThat(ledger.backoff(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(ledger.backoff(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(ledger.backoff(3)).isEqualTo(Duration.ofSeconds(20));
        assertThat(ledger.backoff(4)).isEqualTo(Duration.ofSeconds(30));
        assertThat(ledger.backoff(50)).isEqualTo(Duration.ofSeconds(30));
    }

    // ------------------------------------------------------------------
    // ack() / recoverExpiredLeases()
    // ------------------------------------------------------------------

    @Test
    void ack_leaseHolder_marksAcked() {
        Trigger t = delivered(1);
        when(triggerRepo.lockById(ID)).thenReturn(Optional.of(t));

        assertThat(ledger.ack(message(1), "instance-a")).isTrue();

        assertThat(t.getState()).isEqualTo(TriggerState.ACKED);
        assertThat(t.getAckedAt()).isNotNull();
    }

    @Test
    void ack_leasedByOtherConsumer_leftInFlight() {
        Trigger t = delivered(2);
        t.setConsumer("instance-b");
        when(triggerRepo.lockById(ID)).thenReturn(Optional.of(t));

        assertThat(ledger.ack(message(1), "instance-a")).isFalse();

        assertThat(t.getState()).isEqualTo(TriggerState.IN_FLIGHT);
        assertThat(t.getConsumer()).isEqualTo("instance-b");
        assertThat(t.getAckedAt()).isNull();
        verify(triggerRepo, never()).save(any());
    }

    @Test
    void ack_afterSweepRequeued_leftPending() {
        Trigger t = delivered(1);
        t.setState(TriggerState.PENDING);
        when(triggerRepo.lockById(ID)).thenReturn(Optional.of(t));

        assertThat(ledger.ack(message(1), "instance-a")).isFalse();
        assertThat(t.getState()).isEqualTo(TriggerState.PENDING);
    }

    @Test
    void recoverExpiredLeases_requeuesEach() {
        Trigger t = delivered(1);
        when(triggerRepo.findByStateAndLeasedUntilBefore(eq(TriggerState.IN_FLIGHT), any()))
                .thenReturn(List.of(t));

        assertThat(ledger.recoverExpiredLeases()).isEqualTo(1);
        assertThat(t.getState()).isEqualTo(TriggerState.PENDING);
        assertThat(t.getLastError()).contains("Lease expired");
    }

    private static TriggerMessage message(int delivery) {
        return new TriggerMessage(ID, TriggerTopic.LOGISTICS_PLANNING, "r1", delivery);
    }

    private static Trigger delivered(int times) {
        Trigger t = new Trigger(TriggerTopic.LOGISTICS_PLANNING, "r1");
        t.setState(TriggerState.IN_FLIGHT);
        t.setConsumer("instance-a");
        t.setLeasedUntil(Instant.now());
        for (int i = 0; i < times; i++) t.incrementDeliveryCount();
        return t;
    }
}
