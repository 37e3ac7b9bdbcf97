package com.loadspec.service.api;

import java.util.List;

/**
 * Asks the backend to fix a rejected response.
 */
@FunctionalInterface
public interface CorrectionRequester {

    /**
     * @param previousResponse The response that failed validation.
     * @param errors           What was wrong with it.
     * @return The backend's corrected response text.
     */
    String requestCorrection(String previousResponse, List<String> errors);
}
