package com.showdownlab.optimizer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.showdownlab.optimizer.domain.HistoricalGame;
import com.showdownlab.optimizer.domain.HistoricalGameEntity;
import com.showdownlab.optimizer.repository.HistoricalGameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Key-value store of historical games backed by PostgreSQL with a Redis read cache.
 * Writes are idempotent upserts by game id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoricalGameVault {

    private final HistoricalGameRepository historicalGameRepository;
    private final ObjectMapper objectMapper;

    /**
     * Load a cached game, or null when it has never been stored.
     */
    @Cacheable(value = "historicalGames", key = "#gameId", unless = "#result == null")
    public HistoricalGame get(String gameId) {
        Optional<HistoricalGameEntity> entity = historicalGameRepository.findById(gameId);
        if (entity.isEmpty()) {
            log.debug("Historical game {} not in vault", gameId);
            return null;
        }
        return fromEntity(entity.get());
    }

    @CachePut(value = "historicalGames", key = "#game.gameId")
    public HistoricalGame put(HistoricalGame game) {
        if (game == null || game.getGameId() == null || game.getGameId().isBlank()) {
            throw new IllegalArgumentException("Historical game must have an id");
        }

        try {
            HistoricalGameEntity entity = HistoricalGameEntity.builder()
                    .gameId(game.getGameId())
                    .description(game.getDescription())
                    .playerCount(game.getPlayers().size())
                    .payloadJson(objectMapper.writeValueAsString(game))
                    .createdAt(LocalDateTime.now())
                    .build();
            historicalGameRepository.save(entity);
            log.debug("Stored historical game {} with {} players", game.getGameId(), game.getPlayers().size());
            return game;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize historical game {}", game.getGameId(), e);
            throw new RuntimeException("Failed to store historical game " + game.getGameId(), e);
        }
    }

    public long count() {
        return historicalGameRepository.count();
    }

    /**
     * Every stored game, ordered by id.
     */
    public List<HistoricalGame> findAll() {
        List<HistoricalGame> games = new ArrayList<>();
        for (HistoricalGameEntity entity : historicalGameRepository.findAllByOrderByGameIdAsc()) {
            games.add(fromEntity(entity));
        }
        return games;
    }

    private HistoricalGame fromEntity(HistoricalGameEntity entity) {
        try {
            return objectMapper.readValue(entity.getPayloadJson(), HistoricalGame.class);
        } catch (JsonProcessingException e) {
            log.error("Corrupt payload for historical game {}", entity.getGameId(), e);
            throw new RuntimeException("Failed to read historical game " + entity.getGameId(), e);
        }
    }
}
