package org.rentalrepairs.engine.domain.model;

/**
 * Thrown when a repair request is asked to make a transition its lifecycle forbids.
 */
public class RequestStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final RequestStatus currentStatus;

    public RequestStateException(String message, RequestStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public RequestStatus getCurrentStatus() {
        return currentStatus;
    }
}
