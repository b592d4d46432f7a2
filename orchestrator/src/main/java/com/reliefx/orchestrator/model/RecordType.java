package com.reliefx.orchestrator.model;

/** The three collections held by the State Store. */
public enum RecordType {
    REQUEST,
    DAMAGE_REPORT,
    LOGISTICS_PLAN
}
