package com.showdownlab.optimizer.service;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(Long jobId) {
        super("Analysis job not found: " + jobId);
    }
}
