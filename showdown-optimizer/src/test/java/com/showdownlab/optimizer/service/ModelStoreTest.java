package com.showdownlab.optimizer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.showdownlab.optimizer.domain.ModelPerformance;
import com.showdownlab.optimizer.domain.StatFeature;
import com.showdownlab.optimizer.domain.StatWeights;
import com.showdownlab.optimizer.domain.TunedModel;
import com.showdownlab.optimizer.domain.TunedModelEntity;
import com.showdownlab.optimizer.repository.TunedModelRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ModelStore persistence and ranking.
 */
@ExtendWith(MockitoExtension.class)
class ModelStoreTest {

    @Mock
    private TunedModelRepository tunedModelRepository;

    private ModelStore modelStore;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        modelStore = new ModelStore(tunedModelRepository, objectMapper);
    }

    @Test
    void testPut_StoresPayloadAndRankingColumns() throws Exception {
        // Arrange
        TunedModel model = model("m-1", 2.5, LocalDateTime.of(2024, 9, 1, 12, 0));
        ArgumentCaptor<TunedModelEntity> captor = ArgumentCaptor.forClass(TunedModelEntity.class);

        // Act
        modelStore.put(model);

        // Assert
        verify(tunedModelRepository).save(captor.capture());
        TunedModelEntity entity = captor.getValue();
        assertEquals("m-1", entity.getId());
        assertEquals(2.5, entity.getValidationMae());
        assertEquals(1.0, entity.getTrainingMae());
        assertEquals(model, objectMapper.readValue(entity.getPayloadJson(), TunedModel.class));
    }

    @Test
    void testPut_MissingId_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> modelStore.put(model(null, 1.0, null)));
        verify(tunedModelRepository, never()).save(any());
    }

    @Test
    void testGet_ReadsPayload() throws Exception {
        // Arrange
        TunedModel model = model("m-2", 3.0, LocalDateTime.of(2024, 9, 1, 12, 0));
        when(tunedModelRepository.findById("m-2")).thenReturn(Optional.of(entity(model)));

        // Act
        Optional<TunedModel> loaded = modelStore.get("m-2");

        // Assert
        assertTrue(loaded.isPresent());
        assertEquals(0.1, loaded.get().getWeights().get(StatFeature.REC_YDS));
        assertEquals(3.0, loaded.get().getPerformance().getValidationMae());
    }

    @Test
    void testGet_Missing() {
        when(tunedModelRepository.findById("nope")).thenReturn(Optional.empty());

        assertTrue(modelStore.get("nope").isEmpty());
    }

    @Test
    void testList_RankedByValidationMaeThenNewest() throws Exception {
        // Arrange
        TunedModel unvalidated = model("unvalidated", null, LocalDateTime.of(2024, 9, 3, 12, 0));
        TunedModel older = model("older", 2.0, LocalDateTime.of(2024, 9, 1, 12, 0));
        TunedModel newer = model("newer", 2.0, LocalDateTime.of(2024, 9, 2, 12, 0));
        TunedModel best = model("best", 1.5, LocalDateTime.of(2024, 8, 1, 12, 0));
        when(tunedModelRepository.findAll())
                .thenReturn(List.of(entity(unvalidated), entity(older), entity(newer), entity(best)));

        // Act
        List<String> ids = modelStore.list().stream().map(TunedModel::getId).collect(Collectors.toList());

        // Assert
        assertEquals(List.of("best", "newer", "older", "unvalidated"), ids);
    }

    @Test
    void testDelete() {
        when(tunedModelRepository.existsById("m-1")).thenReturn(true);
        when(tunedModelRepository.existsById("m-2")).thenReturn(false);

        assertTrue(modelStore.delete("m-1"));
        assertFalse(modelStore.delete("m-2"));
        verify(tunedModelRepository).deleteById("m-1");
        verify(tunedModelRepository, never()).deleteById("m-2");
    }

    private TunedModelEntity entity(TunedModel model) throws Exception {
        return TunedModelEntity.builder()
                .id(model.getId())
                .name(model.getName())
                .payloadJson(objectMapper.writeValueAsString(model))
                .createdAt(model.getCreatedAt())
                .build();
    }

    private static TunedModel model(String id, Double validationMae, LocalDateTime createdAt) {
        return TunedModel.builder()
                .id(id)
                .name("Model " + id)
                .weights(StatWeights.of(Map.of(StatFeature.REC_YDS, 0.1, StatFeature.RECEPTIONS, 0.5)))
                .sourceDescription("test")
                .createdAt(createdAt)
                .performance(ModelPerformance.builder()
                        .trainingMae(1.0)
                        .trainingResidualStdDev(1.2)
                        .trainingSampleSize(40)
                        .validationMae(validationMae)
                        .build())
                .build();
    }
}
