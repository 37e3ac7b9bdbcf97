package com.loadspec.service.api;

import com.loadspec.model.recovery.RecoveryStrategy;
import com.loadspec.model.spec.LoadTestSpec;

/**
 * Performs one recovery strategy on behalf of the coordinator.
 */
@FunctionalInterface
public interface RecoveryExecutor {

    /**
     * @param strategy The strategy to attempt.
     * @return The spec produced by the strategy.
     * @throws Exception if the attempt failed; the coordinator moves on to the next strategy.
     */
    LoadTestSpec execute(RecoveryStrategy strategy) throws Exception;
}
