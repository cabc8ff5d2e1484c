package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.StatWeights;

import java.util.Optional;

/**
 * Optional external provider of weight vectors that would have best explained
 * a finished game. Failures are tolerated by the caller.
 */
public interface HindsightWeightSource {

    Optional<StatWeights> hindsightWeights(HistoricalGame game);
}
