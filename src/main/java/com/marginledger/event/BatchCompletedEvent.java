package com.marginledger.event;

import com.marginledger.domain.model.BatchResult;
import org.springframework.context.ApplicationEvent;

/** Published once per keeper batch, after all items have been evaluated. */
public class BatchCompletedEvent extends ApplicationEvent {

    private final int assetId;
    private final String operation;
    private final BatchResult result;

    public BatchCompletedEvent(Object source, int assetId, String operation, BatchResult result) {
        super(source);
        this.assetId = assetId;
        this.operation = operation;
        this.result = result;
    }

    public int getAssetId() {
        return assetId;
    }

    /** {@code execLimits} or {@code closeBatch}. */
    public String getOperation() {
        return operation;
    }

    public BatchResult getResult() {
        return result;
    }
}
