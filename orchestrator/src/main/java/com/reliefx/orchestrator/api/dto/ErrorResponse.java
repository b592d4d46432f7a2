package com.reliefx.orchestrator.api.dto;

import java.util.List;

/** Body of a 400 from POST /requests. */
public record ErrorResponse(String error, List<String> violations) {}
