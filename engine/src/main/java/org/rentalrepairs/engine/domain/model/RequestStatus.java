package org.rentalrepairs.engine.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a repair request.
 */
public enum RequestStatus {
    DRAFT,
    SUBMITTED,
    DECLINED,
    SCHEDULED,
    DONE,
    FAILED,
    CLOSED;

    private static final Map<RequestStatus, Set<RequestStatus>> TRANSITIONS = new EnumMap<>(RequestStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(SUBMITTED));
        TRANSITIONS.put(SUBMITTED, EnumSet.of(SCHEDULED, DECLINED));
        TRANSITIONS.put(SCHEDULED, EnumSet.of(DONE, FAILED));
        TRANSITIONS.put(FAILED, EnumSet.of(SCHEDULED));
        TRANSITIONS.put(DONE, EnumSet.of(CLOSED));
        TRANSITIONS.put(DECLINED, EnumSet.of(CLOSED));
        TRANSITIONS.put(CLOSED, EnumSet.noneOf(RequestStatus.class));
    }

    public boolean canTransitionTo(RequestStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<RequestStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /**
     * Whether a worker may still be assigned to a request in this status.
     */
    public boolean isAssignable() {
        return this != CLOSED && this != DONE && this != FAILED && this != DECLINED;
    }

    public boolean isTerminal() {
        return this == CLOSED || this == DECLINED;
    }
}
