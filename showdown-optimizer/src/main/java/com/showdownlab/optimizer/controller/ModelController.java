package com.showdownlab.optimizer.controller;

import com.showdownlab.optimizer.domain.TunedModel;
import com.showdownlab.optimizer.service.ModelNotFoundException;
import com.showdownlab.optimizer.service.ModelStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for saved tuned models.
 */
@RestController
@RequestMapping("/models")
@RequiredArgsConstructor
@Slf4j
public class ModelController {

    private final ModelStore modelStore;

    /**
     * All saved models, best validation MAE first.
     */
    @GetMapping
    public ResponseEntity<List<TunedModel>> listModels() {
        return ResponseEntity.ok(modelStore.list());
    }

    @GetMapping("/{modelId}")
    public ResponseEntity<TunedModel> getModel(@PathVariable String modelId) {
        return ResponseEntity.ok(modelStore.get(modelId).orElseThrow(() -> new ModelNotFoundException(modelId)));
    }

    @DeleteMapping("/{modelId}")
    public ResponseEntity<Void> deleteModel(@PathVariable String modelId) {
        log.info("DELETE /models/{}", modelId);
        if (!modelStore.delete(modelId)) {
            throw new ModelNotFoundException(modelId);
        }
        return ResponseEntity.noContent().build();
    }
}
