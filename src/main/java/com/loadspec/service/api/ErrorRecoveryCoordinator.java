package com.loadspec.service.api;

import com.loadspec.model.recovery.ErrorLevel;
import com.loadspec.model.recovery.ParseError;
import com.loadspec.model.recovery.RecoveryResult;
import com.loadspec.model.recovery.RecoveryStrategy;
import java.util.List;

public interface ErrorRecoveryCoordinator {

    /**
     * Classifies a failure raised by a pipeline stage.
     *
     * @param error The failure.
     * @param level The stage it came from.
     * @return The classified error with suggestions and a primary strategy.
     */
    ParseError classify(Throwable error, ErrorLevel level);

    /**
     * Candidate strategies for an error, recoverable ones only, highest confidence first.
     */
    List<RecoveryStrategy> strategiesFor(ParseError error);

    /**
     * Tries strategies in order until one yields a spec or the attempt budget for this
     * (level, type, input) key is spent.
     *
     * @param error    The classified error.
     * @param input    The operator input, used to key attempt counters.
     * @param executor Performs each strategy.
     * @return The outcome, including the sequence of strategies tried.
     */
    RecoveryResult recover(ParseError error, String input, RecoveryExecutor executor);
}
