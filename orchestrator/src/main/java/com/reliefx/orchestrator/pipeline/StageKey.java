package com.reliefx.orchestrator.pipeline;

/**
 * What a claim is taken on: one stage of one request.
 */
public record StageKey(Stage stage, String requestId) {

    public static StageKey damage(String requestId) {
        return new StageKey(Stage.DAMAGE, requestId);
    }

    public static StageKey logistics(String requestId) {
        return new StageKey(Stage.LOGISTICS, requestId);
    }

    @Override
    public String toString() {
        return stage + ":" + requestId;
    }
}
