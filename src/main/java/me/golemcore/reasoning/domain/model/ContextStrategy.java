package me.golemcore.reasoning.domain.model;

/**
 * Context budgeting strategy applied before every inference call.
 */
public enum ContextStrategy {
    SLIDING_WINDOW, OBSERVATION_MASKING, ANCHORED_SUMMARY
}
