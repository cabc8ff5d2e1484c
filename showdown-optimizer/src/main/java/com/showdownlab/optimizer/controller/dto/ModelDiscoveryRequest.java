package com.showdownlab.optimizer.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a model discovery and validation cycle.
 * Unset fields use the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelDiscoveryRequest {

    @Min(value = 4, message = "At least 4 games are required")
    @Max(value = 500, message = "At most 500 games per discovery run")
    private Integer gameCount;

    @Min(value = 10, message = "Training split must be at least 10 percent")
    @Max(value = 95, message = "Training split cannot exceed 95 percent")
    private Integer trainSplitPercent;

    @Positive(message = "Ensemble size must be positive")
    private Integer topKEnsemble;

    @Builder.Default
    private Boolean saveModels = Boolean.TRUE;

    // Distinguishes otherwise identical submissions
    private String runLabel;
}
