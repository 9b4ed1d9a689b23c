package com.cortexplatform.core.event;

/**
 * Event types routed by the {@link EventBus}.
 */
public final class EventTypes {

    /**
     * User input accepted by the input API.
     */
    public static final String INPUT = "input";

    /**
     * Assistant or system output destined for stream clients.
     */
    public static final String OUTPUT = "output";

    private EventTypes() {
    }
}
