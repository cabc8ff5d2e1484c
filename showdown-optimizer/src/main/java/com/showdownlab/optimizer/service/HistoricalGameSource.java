package com.showdownlab.optimizer.service;

import com.showdownlab.optimizer.domain.HistoricalGame;

import java.util.List;

/**
 * Upstream provider of finished games, consulted when the vault has no copy.
 */
public interface HistoricalGameSource {

    /**
     * Ids of up to {@code limit} games available from this source.
     */
    List<String> catalog(int limit);

    /**
     * Fetch a complete game with final stats.
     *
     * @throws RuntimeException when the game cannot be obtained
     */
    HistoricalGame fetch(String gameId);
}
