package com.municipality.wastecollection.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution states of a collection route.
 * COMPLETED and CANCELLED are terminal; CANCELLED is reachable from every other non-terminal state.
 */
public enum RouteStatus {
    PENDING,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(RouteStatus next) {
        if (isTerminal() || next == null) {
            return false;
        }
        return allowedTargets().contains(next);
    }

    private Set<RouteStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ASSIGNED, CANCELLED);
            case ASSIGNED:
                return EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS:
                return EnumSet.of(COMPLETED, CANCELLED);
            default:
                return EnumSet.noneOf(RouteStatus.class);
        }
    }

    public static Set<RouteStatus> activeStatuses() {
        return EnumSet.of(PENDING, ASSIGNED, IN_PROGRESS);
    }
}
