package com.showdownlab.optimizer.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one discovery cycle: ranked models plus non-fatal warnings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ValidationReport {
    private int trainingSetSize;
    private int validationSetSize;

    @Builder.Default
    private List<TunedModel> models = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
