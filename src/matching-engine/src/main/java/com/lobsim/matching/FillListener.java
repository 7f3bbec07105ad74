package com.lobsim.matching;

import com.lobsim.domain.Fill;

/**
 * Receives one callback per trade leg. Called on the engine's thread once
 * the submission that caused the trade has finished matching.
 */
@FunctionalInterface
public interface FillListener {
    void onFill(Fill fill);
}
