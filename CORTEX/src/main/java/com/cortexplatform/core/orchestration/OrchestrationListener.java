package com.cortexplatform.core.orchestration;

import com.cortexplatform.core.event.ConversationKey;

/**
 * Observer of orchestration phase changes. Callbacks run on the orchestration thread and must not block.
 */
public interface OrchestrationListener {

    default void onPhaseChange(ConversationKey key, OrchestrationPhase from, OrchestrationPhase to) {
    }
}
