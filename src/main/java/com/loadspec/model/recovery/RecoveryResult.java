package com.loadspec.model.recovery;

import com.loadspec.model.spec.LoadTestSpec;
import java.util.List;

/**
 * Outcome of a recovery run.
 *
 * @param success      Whether a strategy produced a spec.
 * @param spec         The recovered spec, {@code null} on failure.
 * @param error        The last failure, {@code null} on success.
 * @param attemptsUsed Strategy attempts made during this run.
 * @param recoveryPath Strategy labels in the order they were tried.
 * @param strategy     The strategy that succeeded, {@code null} on failure.
 * @param confidence   Confidence of the successful strategy, 0 on failure.
 */
public record RecoveryResult(boolean success,
                             LoadTestSpec spec,
                             ParseError error,
                             int attemptsUsed,
                             List<String> recoveryPath,
                             StrategyType strategy,
                             double confidence) {

    public RecoveryResult {
        recoveryPath = List.copyOf(recoveryPath);
    }
}
