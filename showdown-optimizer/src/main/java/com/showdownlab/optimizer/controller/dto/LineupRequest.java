package com.showdownlab.optimizer.controller.dto;

import com.showdownlab.optimizer.domain.Player;
import com.showdownlab.optimizer.domain.Position;
import com.showdownlab.optimizer.domain.ScoringMode;
import com.showdownlab.optimizer.domain.StrategyPreset;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for a synchronous lineup optimization.
 * Unset constraint fields fall back to the preset, then to configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineupRequest {

    @NotEmpty(message = "Player pool is required")
    private List<Player> players;

    @NotNull(message = "Lineup count is required")
    @Positive(message = "Lineup count must be positive")
    @Max(value = 150, message = "At most 150 lineups per request")
    private Integer lineupCount;

    @Builder.Default
    private ScoringMode scoringMode = ScoringMode.MEAN;

    @Positive(message = "Salary cap must be positive")
    private Integer salaryCap;

    @Min(value = 2, message = "Roster size must be at least 2")
    private Integer rosterSize;

    @DecimalMin(value = "1.0", message = "Captain multiplier must be at least 1.0")
    private Double captainMultiplier;

    private Map<Position, Integer> maxPerPosition;

    @Builder.Default
    private Set<String> lockedPlayerIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> excludedPlayerIds = new LinkedHashSet<>();

    private Boolean requireCaptainStack;
    private Boolean requireOpponentBringBack;
    private StrategyPreset preset;

    @DecimalMin(value = "0.0", inclusive = false, message = "Max exposure must be above 0")
    @DecimalMax(value = "1.0", message = "Max exposure cannot exceed 1")
    private Double maxExposure;

    // Re-project players that carry stat projections with this saved model
    private String modelId;
}
