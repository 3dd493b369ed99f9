package com.ordergateway.event;

import com.ordergateway.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconciliation pass, scheduled or manual, including failed ones.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;
    private final boolean manual;

    /**
     * @param result the pass outcome; {@code result.isSuccess()} is false when the venue was unreachable
     * @param manual true if triggered on demand, false if scheduled
     */
    public ReconciliationEvent(Object source, ReconciliationResult result, boolean manual) {
        super(source);
        this.result = result;
        this.manual = manual;
    }

    public ReconciliationResult getResult() {
        return result;
    }

    public boolean isManual() {
        return manual;
    }
}
