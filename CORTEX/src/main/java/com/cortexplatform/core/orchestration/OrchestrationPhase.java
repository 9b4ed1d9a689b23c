package com.cortexplatform.core.orchestration;

/**
 * Stage of a conversation's in-flight orchestration.
 */
public enum OrchestrationPhase {
    IDLE,
    AWAITING_HISTORY,
    AWAITING_CONTEXT,
    GENERATING,
    PUBLISHING
}
