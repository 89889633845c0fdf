package com.eyelevel.batchorchestrator.service.quota;

import com.eyelevel.batchorchestrator.model.PlanPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pre-flight check of a bulk run against the plan's batch-size cap. An oversized set is never
 * truncated silently: the caller gets {@link GateDecision#CONFIRMATION_REQUIRED} and has to
 * {@link #resolve(GateEvaluation, GateChoice) resolve} it with the user's choice.
 */
@Slf4j
@Component
public class QuotaGate {

    public <T> GateEvaluation<T> evaluate(List<T> pending, PlanPolicy policy) {
        GateDecision decision;
        if (pending.isEmpty()) {
            decision = GateDecision.NOTHING_PENDING;
        } else if (policy.exceedsBatchSize(pending.size())) {
            decision = GateDecision.CONFIRMATION_REQUIRED;
        } else {
            decision = GateDecision.PROCEED;
        }
        log.debug("Gate evaluated {} pending items against {}: {}", pending.size(), policy, decision);
        return new GateEvaluation<>(decision, pending, policy);
    }

    /**
     * @return the items to schedule, possibly empty.
     */
    public <T> List<T> resolve(GateEvaluation<T> evaluation, GateChoice choice) {
        if (evaluation.decision() == GateDecision.NOTHING_PENDING) {
            return List.of();
        }
        List<T> selected = switch (choice) {
            case CANCEL, UPGRADE -> List.of();
            case PROCESS_ALL -> evaluation.pending();
            case PROCESS_CAPPED -> evaluation.policy().isBatchSizeBounded()
                                   ? evaluation.pending().subList(0, Math.min(evaluation.pendingCount(),
                                                                              evaluation.limit()))
                                   : evaluation.pending();
        };
        log.info("Gate choice {} selected {} of {} pending items", choice, selected.size(),
                 evaluation.pendingCount());
        return selected;
    }
}
