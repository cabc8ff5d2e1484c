package com.showdownlab.optimizer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Saved tuned model. Ranking columns are denormalised from the JSON payload.
 */
@Entity
@Table(name = "tuned_models", indexes = {
        @Index(name = "idx_tuned_models_validation_mae", columnList = "validation_mae")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TunedModelEntity {

    @Id
    @Column(name = "id", length = 120)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "source_description", columnDefinition = "TEXT")
    private String sourceDescription;

    @Column(name = "training_mae")
    private Double trainingMae;

    @Column(name = "validation_mae")
    private Double validationMae;

    @Column(name = "payload_json", columnDefinition = "TEXT", nullable = false)
    private String payloadJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
