package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.model.AnalysisStatus;
import com.reliefx.orchestrator.model.DamageReport;

import java.time.Instant;
import java.util.List;

public record DamageReportView(
        AnalysisStatus        status,
        List<FindingView>     findings,
        String                analysisModel,
        String                errorSummary,
        String                workerId,
        int                   attempt,
        Instant               claimedAt,
        Instant               completedAt
) {
    public record FindingView(String location, String category, double confidence) {}

    public static DamageReportView from(DamageReport r) {
        return new DamageReportView(
                r.getStatus(),
                r.getFindings().stream()
                        .map(f -> new FindingView(f.getLocation(), f.getCategory(), f.getConfidence()))
                        .toList(),
                r.getAnalysisModel(),
                r.getErrorSummary(),
                r.getWorkerId(),
                r.getAttempt(),
                r.getClaimedAt(),
                r.getCompletedAt()
        );
    }
}
