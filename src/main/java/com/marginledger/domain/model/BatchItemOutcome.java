package com.marginledger.domain.model;

import com.marginledger.domain.enums.BatchItemStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one id within a batch. For processed items {@code longLotsDelta} and
 * {@code shortLotsDelta} carry the exposure change, folded once after the batch.
 */
@Value
@Builder
public class BatchItemOutcome {

    long tradeId;
    BatchItemStatus status;
    String reason;
    long longLotsDelta;
    long shortLotsDelta;
    long realizedPnl;

    public static BatchItemOutcome skipped(long tradeId, String reason) {
        return BatchItemOutcome.builder()
                .tradeId(tradeId)
                .status(BatchItemStatus.SKIPPED)
                .reason(reason)
                .build();
    }

    public boolean isProcessed() {
        return status == BatchItemStatus.PROCESSED;
    }
}
