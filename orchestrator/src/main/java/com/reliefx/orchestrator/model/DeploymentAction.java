package com.reliefx.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;

/**
 * One step of a LogisticsPlan: send {@code quantity} units of {@code resourceType}
 * to {@code destination}. Lower priority numbers are dispatched first.
 */
@Embeddable
public class DeploymentAction {

    @Column(name = "resource_type", nullable = false)
    private String resourceType;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false)
    private String destination;

    @Column(nullable = false)
    private int priority;

    protected DeploymentAction() {}   // required by JPA

    public DeploymentAction(String resourceType, int quantity, String destination, int priority) {
        this.resourceType = resourceType;
        this.quantity     = quantity;
        this.destination  = destination;
        this.priority     = priority;
    }

    public String getResourceType() { return resourceType; }
    public int    getQuantity()     { return quantity; }
    public String getDestination()  { return destination; }
    public int    getPriority()     { return priority; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeploymentAction other)) return false;
        return quantity == other.quantity
                && priority == other.priority
                && Objects.equals(resourceType, other.resourceType)
                && Objects.equals(destination, other.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, quantity, destination, priority);
    }

    @Override
    public String toString() {
        return "P" + priority + " " + quantity + "x " + resourceType + " -> " + destination;
    }
}
