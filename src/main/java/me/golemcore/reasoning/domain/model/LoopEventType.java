package me.golemcore.reasoning.domain.model;

/**
 * Stable event types written to the journal by the reasoning loop.
 */
public enum LoopEventType {
    STARTED, REASONING_COMPLETE, POLICY_EVALUATED, TOOLS_DISPATCHED, OBSERVATIONS_COLLECTED,
    RECOVERY_TRIGGERED, TERMINATED
}
