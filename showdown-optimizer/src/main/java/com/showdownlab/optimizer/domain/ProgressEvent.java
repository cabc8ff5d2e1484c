package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Step description plus percent complete for a long-running pipeline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProgressEvent {
    private String message;
    private int percent;
}
