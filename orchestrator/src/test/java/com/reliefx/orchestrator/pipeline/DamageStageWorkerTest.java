package com.reliefx.orchestrator.pipeline;

import com.reliefx.orchestrator.bus.TriggerBus;
import com.reliefx.orchestrator.bus.TriggerPublishException;
import com.reliefx.orchestrator.config.PipelineProperties;
import com.reliefx.orchestrator.engine.AnalysisResult;
import com.reliefx.orchestrator.engine.EngineException;
import com.reliefx.orchestrator.engine.ImageryAnalyzer;
import com.reliefx.orchestrator.model.*;
import com.reliefx.orchestrator.store.ClaimResult;
import com.reliefx.orchestrator.store.StateStore;
import com.reliefx.orchestrator.support.Fixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DamageStageWorker.
 *
 * Store, bus and engine are mocked; the guard and the call runner are real.
 */
@ExtendWith(MockitoExtension.class)
class DamageStageWorkerTest {

    static final String ID = "0192d3a4-0000-7000-8000-000000000001";

    @Mock StateStore      store;
    @Mock TriggerBus      bus;
    @Mock ImageryAnalyzer analyzer;

    SimpleMeterRegistry meters;
    PipelineProperties  properties;
    DamageStageWorker   worker;

    @BeforeEach
    void setUp() {
        meters     = new SimpleMeterRegistry();
        properties = Fixtures.properties();
        worker     = newWorker();
    }

    private DamageStageWorker newWorker() {
        return new DamageStageWorker(store, bus, new IdempotencyGuard(store, meters), analyzer,
                new EngineCallRunner(meters), properties, meters);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void process_freshTrigger_completesReportAndHandsOff() {
        givenUnclaimedRequest();
        when(analyzer.analyze(any())).thenReturn(Fixtures.analysis());
        when(store.completeDamageReport(eq(ID), anyString(), any(), any())).thenReturn(true);

        StageOutcome outcome = worker.process(ID);

        assertThat(outcome).isEqualTo(StageOutcome.COMPLETED);

        // The owner that completes is the owner that claimed
        ArgumentCaptor<String> claimOwner = ArgumentCaptor.forClass(String.class);
        verify(store).claimDamageReport(eq(ID), claimOwner.capture());
        verify(store).completeDamageReport(ID, claimOwner.getValue(), Fixtures.findings(), "damage-net-v3");
        assertThat(claimOwner.getValue()).startsWith("test-instance/");

        InOrder order = inOrder(store, bus);
        order.verify(store).updateRequestStatus(ID, RequestStatus.ANALYZING);
        order.verify(store).updateRequestStatus(ID, RequestStatus.ASSESSED);
        order.verify(bus).publish(TriggerTopic.LOGISTICS_PLANNING, ID);
        order.verify(store).markLogisticsHandoff(ID);

        assertThat(meters.counter("reliefx.stage.outcomes", "stage", "DAMAGE", "outcome", "COMPLETED").count())
                .isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Guard
    // ------------------------------------------------------------------

    @Test
    void process_reportAlreadyAnalyzing_duplicateNoOp() {
        when(store.findDamageReport(ID)).thenReturn(Optional.of(report(AnalysisStatus.ANALYZING)));

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.DUPLICATE_DELIVERY);

        verify(store, never()).claimDamageReport(any(), any());
        verifyNoInteractions(analyzer, bus);
    }

    @Test
    void process_reportFailed_isTerminalForRedeliveries() {
        when(store.findDamageReport(ID)).thenReturn(Optional.of(report(AnalysisStatus.FAILED)));

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.DUPLICATE_DELIVERY);

        verifyNoInteractions(analyzer, bus);
    }

    @Test
    void process_completeReportHandedOff_duplicateNoOp() {
        DamageReport done = report(AnalysisStatus.COMPLETE);
        done.setHandoffAt(Instant.now());
        when(store.findDamageReport(ID)).thenReturn(Optional.of(done));

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.DUPLICATE_DELIVERY);

        verifyNoInteractions(analyzer, bus);
    }

    @Test
    void process_completeReportNeverHandedOff_republishesLogisticsTrigger() {
        when(store.findDamageReport(ID)).thenReturn(Optional.of(report(AnalysisStatus.COMPLETE)));

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.DUPLICATE_DELIVERY);

        verify(bus).publish(TriggerTopic.LOGISTICS_PLANNING, ID);
        verify(store).markLogisticsHandoff(ID);
        verifyNoInteractions(analyzer);
    }

    @Test
    void process_claimLostToConcurrentWorker_noEngineCall() {
        when(store.findDamageReport(ID)).thenReturn(Optional.empty());
        when(store.findRequest(ID)).thenReturn(Optional.of(Fixtures.request(ID)));
        when(store.claimDamageReport(eq(ID), anyString())).thenReturn(ClaimResult.ALREADY_OWNED_OR_DONE);

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.CLAIM_CONFLICT);

        verifyNoInteractions(analyzer, bus);
        verify(store, never()).updateRequestStatus(any(), any());
    }

    @Test
    void process_unknownRequest_preconditionFailureForBusRetry() {
        when(store.findDamageReport(ID)).thenReturn(Optional.empty());
        when(store.findRequest(ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> worker.process(ID)).isInstanceOf(PreconditionException.class);

        verify(store, never()).claimDamageReport(any(), any());
    }

    // ------------------------------------------------------------------
    // Engine failure
    // ------------------------------------------------------------------

    @Test
    void process_engineError_reportAndRequestFailedNoHandoff() {
        givenUnclaimedRequest();
        when(analyzer.analyze(any())).thenThrow(new EngineException("HTTP 503"));
        when(store.failDamageReport(eq(ID), anyString(), anyString())).thenReturn(true);

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.FAILED);

        ArgumentCaptor<String> summary = ArgumentCaptor.forClass(String.class);
        verify(store).failDamageReport(eq(ID), anyString(), summary.capture());
        assertThat(summary.getValue()).contains("imagery-analysis failed").contains("HTTP 503");
        verify(store).updateRequestStatus(ID, RequestStatus.FAILED);
        verifyNoInteractions(bus);
    }

    @Test
    void process_engineTimeout_treatedAsFailure() {
        properties.getEngines().getAnalysis().setTimeout(Duration.ofMillis(50));
        worker = newWorker();
        givenUnclaimedRequest();
        when(analyzer.analyze(any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return Fixtures.analysis();
        });
        when(store.failDamageReport(eq(ID), anyString(), anyString())).thenReturn(true);

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.FAILED);

        verify(store).failDamageReport(eq(ID), anyString(), contains("timed out"));
        verify(store, never()).completeDamageReport(any(), any(), any(), any());
    }

    @Test
    void process_confidenceOutOfRange_rejectedAsInvalidOutput() {
        givenUnclaimedRequest();
        when(analyzer.analyze(any())).thenReturn(new AnalysisResult(
                List.of(new DamageFinding("Paiporta", "flooded_building", 1.4)), "m"));
        when(store.failDamageReport(eq(ID), anyString(), anyString())).thenReturn(true);

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.FAILED);

        verify(store).failDamageReport(eq(ID), anyString(), contains("outside [0, 1]"));
    }

    @Test
    void process_claimReapedBeforeCompletion_resultDiscarded() {
        givenUnclaimedRequest();
        when(analyzer.analyze(any())).thenReturn(Fixtures.analysis());
        when(store.completeDamageReport(eq(ID), anyString(), any(), any())).thenReturn(false);

        assertThat(worker.process(ID)).isEqualTo(StageOutcome.CLAIM_LOST);

        verify(store, never()).updateRequestStatus(ID, RequestStatus.ASSESSED);
        verifyNoInteractions(bus);
    }

    @Test
    void process_handoffPublishFails_propagatesForRedelivery() {
        givenUnclaimedRequest();
        when(analyzer.analyze(any())).thenReturn(Fixtures.analysis());
        when(store.completeDamageReport(eq(ID), anyString(), any(), any())).thenReturn(true);
        when(bus.publish(TriggerTopic.LOGISTICS_PLANNING, ID))
                .thenThrow(new TriggerPublishException(TriggerTopic.LOGISTICS_PLANNING, ID, new RuntimeException("db down")));

        assertThatThrownBy(() -> worker.process(ID)).isInstanceOf(TriggerPublishException.class);

        verify(store, never()).markLogisticsHandoff(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void givenUnclaimedRequest() {
        when(store.findDamageReport(ID)).thenReturn(Optional.empty());
        when(store.findRequest(ID)).thenReturn(Optional.of(Fixtures.request(ID)));
        when(store.claimDamageReport(eq(ID), anyString())).thenReturn(ClaimResult.ACQUIRED);
    }

    private static DamageReport report(AnalysisStatus status) {
        DamageReport r = new DamageReport(ID, "other-instance/abc");
        r.setStatus(status);
        return r;
    }
}
