package com.showdownlab.optimizer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.showdownlab.optimizer.domain.TunedModel;
import com.showdownlab.optimizer.domain.TunedModelEntity;
import com.showdownlab.optimizer.repository.TunedModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Saved tuned models keyed by id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelStore {

    private final TunedModelRepository tunedModelRepository;
    private final ObjectMapper objectMapper;

    public Optional<TunedModel> get(String modelId) {
        return tunedModelRepository.findById(modelId).map(this::fromEntity);
    }

    /**
     * Insert or replace a model by id.
     */
    public TunedModel put(TunedModel model) {
        if (model == null || model.getId() == null || model.getId().isBlank()) {
            throw new IllegalArgumentException("Tuned model must have an id");
        }

        try {
            TunedModelEntity entity = TunedModelEntity.builder()
                    .id(model.getId())
                    .name(model.getName())
                    .sourceDescription(model.getSourceDescription())
                    .trainingMae(model.getPerformance() != null ? model.getPerformance().getTrainingMae() : null)
                    .validationMae(model.getPerformance() != null ? model.getPerformance().getValidationMae() : null)
                    .payloadJson(objectMapper.writeValueAsString(model))
                    .createdAt(model.getCreatedAt() != null ? model.getCreatedAt() : LocalDateTime.now())
                    .build();
            tunedModelRepository.save(entity);
            log.info("Saved tuned model {} ({})", model.getId(), model.getName());
            return model;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize tuned model {}", model.getId(), e);
            throw new RuntimeException("Failed to save tuned model " + model.getId(), e);
        }
    }

    /**
     * @return true if a model was removed
     */
    public boolean delete(String modelId) {
        if (!tunedModelRepository.existsById(modelId)) {
            return false;
        }
        tunedModelRepository.deleteById(modelId);
        log.info("Deleted tuned model {}", modelId);
        return true;
    }

    /**
     * All models, best validation MAE first and newest first on ties.
     */
    public List<TunedModel> list() {
        return tunedModelRepository.findAll().stream()
                .map(this::fromEntity)
                .sorted(TunedModel.RANKING)
                .collect(Collectors.toList());
    }

    private TunedModel fromEntity(TunedModelEntity entity) {
        try {
            return objectMapper.readValue(entity.getPayloadJson(), TunedModel.class);
        } catch (JsonProcessingException e) {
            log.error("Corrupt payload for tuned model {}", entity.getId(), e);
            throw new RuntimeException("Failed to read tuned model " + entity.getId(), e);
        }
    }
}
