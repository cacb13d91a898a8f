package me.golemcore.reasoning.domain.conversation;

import me.golemcore.reasoning.domain.model.LoopConfig;

/**
 * Creates the budgeter selected by a run's configuration.
 */
public final class ContextBudgeters {

    private ContextBudgeters() {
    }

    public static ContextBudgeter forConfig(LoopConfig config, TokenEstimator estimator) {
        return switch (config.getContextStrategy()) {
        case OBSERVATION_MASKING -> new ObservationMaskingBudgeter(estimator, config.getObservationKeepRecent());
        case ANCHORED_SUMMARY -> new AnchoredSummaryBudgeter(estimator, config.getAnchoredRecentCount());
        default -> new SlidingWindowBudgeter(estimator);
        };
    }
}
