package com.eyelevel.batchorchestrator.service.quota;

import com.eyelevel.batchorchestrator.model.PlanPolicy;

import java.util.List;

/**
 * Outcome of checking a pending set against a plan.
 *
 * @param pending the pending items, in fetched order
 */
public record GateEvaluation<T>(GateDecision decision, List<T> pending, PlanPolicy policy) {

    public GateEvaluation {
        pending = List.copyOf(pending);
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * @return the plan's batch-size cap, {@code null} if unbounded.
     */
    public Integer limit() {
        return policy.maxBatchSize();
    }

    /**
     * @return how many items the cap would leave out.
     */
    public int overflow() {
        return policy.isBatchSizeBounded() ? Math.max(pending.size() - policy.maxBatchSize(), 0) : 0;
    }
}
