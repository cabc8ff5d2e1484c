package com.showdownlab.optimizer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Cached historical game, stored as a JSON payload keyed by game id.
 */
@Entity
@Table(name = "historical_games")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalGameEntity {

    @Id
    @Column(name = "game_id", length = 100)
    private String gameId;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "player_count", nullable = false)
    private int playerCount;

    @Column(name = "payload_json", columnDefinition = "TEXT", nullable = false)
    private String payloadJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
