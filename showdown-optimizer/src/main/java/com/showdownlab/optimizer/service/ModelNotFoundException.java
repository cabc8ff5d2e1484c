package com.showdownlab.optimizer.service;

public class ModelNotFoundException extends RuntimeException {

    public ModelNotFoundException(String modelId) {
        super("Tuned model not found: " + modelId);
    }
}
