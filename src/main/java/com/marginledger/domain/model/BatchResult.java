package com.marginledger.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Counts of processed (executed or closed) and skipped ids plus the per-item outcomes. */
@Value
@Builder
public class BatchResult {

    int processed;
    int skipped;
    List<BatchItemOutcome> outcomes;

    public static BatchResult of(List<BatchItemOutcome> outcomes) {
        int processed = (int) outcomes.stream().filter(BatchItemOutcome::isProcessed).count();
        return BatchResult.builder()
                .processed(processed)
                .skipped(outcomes.size() - processed)
                .outcomes(List.copyOf(outcomes))
                .build();
    }
}
