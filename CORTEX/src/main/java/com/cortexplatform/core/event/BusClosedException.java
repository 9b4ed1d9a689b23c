package com.cortexplatform.core.event;

/**
 * Thrown when publishing to or subscribing on an {@link EventBus} that is shutting down.
 */
public class BusClosedException extends IllegalStateException {

    public BusClosedException(String message) {
        super(message);
    }
}
