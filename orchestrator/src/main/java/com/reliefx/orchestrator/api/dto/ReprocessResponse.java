package com.reliefx.orchestrator.api.dto;

import com.reliefx.orchestrator.pipeline.ReprocessAction;

public record ReprocessResponse(String requestId, ReprocessAction action) {}
