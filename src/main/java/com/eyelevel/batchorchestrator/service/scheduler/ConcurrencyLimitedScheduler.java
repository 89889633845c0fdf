package com.eyelevel.batchorchestrator.service.scheduler;

import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import com.eyelevel.batchorchestrator.model.WorkItem;
import com.eyelevel.batchorchestrator.service.progress.BatchRunState;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.progress.ProgressAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an {@link ItemOperation} over a list of work items with at most {@code k} operations in
 * flight.
 *
 * <p>{@code min(k, n)} workers share one queue and race for its head, so completion order is not
 * the submission order. Every item is attempted at most once and ends in a terminal status when
 * the returned future completes:
 * <ul>
 *     <li>a failing item is recorded on that item only and the batch continues;</li>
 *     <li>after an operation returns {@link ItemOutcome#HALT_BATCH} no further item starts and the
 *     remaining ones fail with {@link ErrorCode#QUOTA_EXHAUSTED}, without quota deduction;</li>
 *     <li>after cancellation the remaining ones fail with {@link ErrorCode#CANCELLED}.</li>
 * </ul>
 * The returned future never completes exceptionally.
 */
@Slf4j
@Component
public class ConcurrencyLimitedScheduler {

    private final Executor executor;

    public ConcurrencyLimitedScheduler(@Qualifier("batchTaskExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * Starts the batch and returns immediately.
     *
     * @param items       the items to process; each must still be in its initial status.
     * @param concurrency the requested limit; clamped to {@code [1, items.size()]}.
     * @param operation   the work to perform per item.
     * @param progress    the aggregator of this run, sized to {@code items.size()}.
     * @param token       cancellation flag, may be {@code null}.
     */
    public <I extends WorkItem<?>> CompletableFuture<BatchSummary> submit(List<I> items, int concurrency,
                                                                          ItemOperation<I> operation,
                                                                          ProgressAggregator progress,
                                                                          CancellationToken token) {
        CancellationToken cancellation = token == null ? new CancellationToken() : token;
        if (items.isEmpty()) {
            log.info("{} batch {} has no items; completing immediately", progress.getKind().getValue(),
                     progress.getRunId());
            return CompletableFuture.completedFuture(progress.finish(BatchRunState.COMPLETED));
        }

        Queue<I> queue = new ConcurrentLinkedQueue<>(items);
        AtomicBoolean halted = new AtomicBoolean();
        int workers = Math.max(1, Math.min(concurrency, items.size()));
        log.info("Starting {} batch {}: {} items, {} workers", progress.getKind().getValue(), progress.getRunId(),
                 items.size(), workers);

        List<CompletableFuture<Void>> futures = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            try {
                futures.add(CompletableFuture.runAsync(
                        () -> drain(queue, operation, progress, halted, cancellation), executor));
            } catch (RejectedExecutionException e) {
                log.error("Executor rejected worker {} of batch {}", i, progress.getRunId(), e);
            }
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                                .handle((ignored, error) -> {
                                    if (error != null) {
                                        log.error("A worker of batch {} terminated abnormally", progress.getRunId(),
                                                  error);
                                    }
                                    return complete(queue, progress, halted.get(), cancellation.isCancelled());
                                });
    }

    /**
     * Runs the batch and waits for it.
     */
    public <I extends WorkItem<?>> BatchSummary execute(List<I> items, int concurrency, ItemOperation<I> operation,
                                                        ProgressAggregator progress, CancellationToken token) {
        return submit(items, concurrency, operation, progress, token).join();
    }

    private <I extends WorkItem<?>> void drain(Queue<I> queue, ItemOperation<I> operation,
                                               ProgressAggregator progress, AtomicBoolean halted,
                                               CancellationToken cancellation) {
        while (!halted.get() && !cancellation.isCancelled()) {
            I item = queue.poll();
            if (item == null) {
                return;
            }
            if (halted.get() || cancellation.isCancelled()) {
                // stopped between the check and the pop; completion settles the item with the rest
                queue.add(item);
                return;
            }
            if (runItem(item, operation, progress) == ItemOutcome.HALT_BATCH && halted.compareAndSet(false, true)) {
                log.warn("Batch {} halted by item '{}'; no further items will start", progress.getRunId(),
                         item.getId());
            }
        }
    }

    private <I extends WorkItem<?>> ItemOutcome runItem(I item, ItemOperation<I> operation,
                                                        ProgressAggregator progress) {
        progress.markCurrent(item.getName());
        ItemOutcome outcome;
        try {
            outcome = operation.apply(item);
        } catch (Exception e) {
            log.error("Unexpected error while processing item '{}' ({})", item.getId(), item.getName(), e);
            failIfOpen(item, ErrorCode.UNKNOWN, ErrorCode.UNKNOWN.getSummary(), QuotaDeduction.UNKNOWN);
            outcome = ItemOutcome.FAILED;
        }

        if (!item.isTerminal()) {
            log.error("Item '{}' was left in status '{}' by its operation", item.getId(), item.getStatus().getValue());
            failIfOpen(item, ErrorCode.UNKNOWN, ErrorCode.UNKNOWN.getSummary(), QuotaDeduction.UNKNOWN);
        }

        if (item.isFailed()) {
            log.debug("Item '{}' failed with code {}", item.getId(), item.getErrorCode());
            progress.recordFailure();
        } else {
            log.debug("Item '{}' finished with status {}", item.getId(), item.getStatus().getValue());
            progress.recordSuccess();
        }
        return outcome == null ? ItemOutcome.FAILED : outcome;
    }

    private <I extends WorkItem<?>> BatchSummary complete(Queue<I> queue, ProgressAggregator progress,
                                                          boolean halted, boolean cancelled) {
        ErrorCode skipCode = halted ? ErrorCode.QUOTA_EXHAUSTED : cancelled ? ErrorCode.CANCELLED : ErrorCode.UNKNOWN;
        int skipped = 0;
        I item;
        while ((item = queue.poll()) != null) {
            failIfOpen(item, skipCode, skipCode.getSummary(), QuotaDeduction.NOT_DEDUCTED);
            progress.recordFailure();
            skipped++;
        }
        if (skipped > 0) {
            log.warn("Batch {} marked {} unstarted items as {}", progress.getRunId(), skipped, skipCode.getValue());
        }

        BatchRunState state;
        if (halted) {
            state = BatchRunState.HALTED;
        } else if (cancelled && skipped > 0) {
            state = BatchRunState.CANCELLED;
        } else {
            state = BatchRunState.COMPLETED;
        }
        return progress.finish(state);
    }

    private static void failIfOpen(WorkItem<?> item, ErrorCode code, String message, QuotaDeduction quota) {
        synchronized (item) {
            if (!item.isTerminal()) {
                item.fail(code, message, quota);
            }
        }
    }
}
