package com.loadspec.model.recovery;

/**
 * A remedial action chosen for a classified failure.
 *
 * @param canRecover       Whether the strategy can be attempted automatically.
 * @param strategy         The action to take.
 * @param confidence       Likelihood the action helps, used for ordering.
 * @param estimatedSuccess Expected success rate, informational.
 * @param maxRetries       Attempts allowed for this strategy.
 * @param retryDelayMs     Wait before attempting, in milliseconds.
 */
public record RecoveryStrategy(boolean canRecover,
                               StrategyType strategy,
                               double confidence,
                               double estimatedSuccess,
                               int maxRetries,
                               long retryDelayMs) {
}
