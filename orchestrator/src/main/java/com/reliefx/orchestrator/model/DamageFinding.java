package com.reliefx.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;

/**
 * One damage detection produced by the imagery-analysis engine.
 *
 * Stored in the damage_findings collection table, ordered by position.
 */
@Embeddable
public class DamageFinding {

    // Place descriptor or "lat,lon" pair as reported by the engine.
    @Column(nullable = false)
    private String location;

    // e.g. "flooding", "collapsed_structure", "road_cut"
    @Column(nullable = false)
    private String category;

    // 0.0 – 1.0
    @Column(nullable = false)
    private double confidence;

    protected DamageFinding() {}   // required by JPA

    public DamageFinding(String location, String category, double confidence) {
        this.location   = location;
        this.category   = category;
        this.confidence = confidence;
    }

    public String getLocation()   { return location; }
    public String getCategory()   { return category; }
    public double getConfidence() { return confidence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DamageFinding other)) return false;
        return Double.compare(confidence, other.confidence) == 0
                && Objects.equals(location, other.location)
                && Objects.equals(category, other.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, category, confidence);
    }

    @Override
    public String toString() {
        return category + "@" + location + " (" + confidence + ")";
    }
}
