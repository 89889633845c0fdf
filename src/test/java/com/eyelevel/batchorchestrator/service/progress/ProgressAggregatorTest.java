package com.eyelevel.batchorchestrator.service.progress;

import com.eyelevel.batchorchestrator.model.BatchKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressAggregatorTest {

    @Test
    void countsSuccessesAndFailures() {
        ProgressAggregator aggregator = new ProgressAggregator(BatchKind.EMBEDDING, 4);

        aggregator.markCurrent("a.png");
        aggregator.recordSuccess();
        aggregator.recordFailure();
        aggregator.recordSuccess();

        BatchProgress progress = aggregator.snapshot();
        assertThat(progress.done()).isEqualTo(3);
        assertThat(progress.errors()).isEqualTo(1);
        assertThat(progress.succeeded()).isEqualTo(2);
        assertThat(progress.total()).isEqualTo(4);
        assertThat(progress.percent()).isEqualTo(75);
        assertThat(progress.currentName()).isEqualTo("a.png");
        assertThat(progress.state()).isEqualTo(BatchRunState.RUNNING);
    }

    @Test
    void refusesMoreCompletionsThanItems() {
        ProgressAggregator aggregator = new ProgressAggregator(BatchKind.ANCHORING, 1);
        aggregator.recordSuccess();

        assertThatThrownBy(aggregator::recordFailure).isInstanceOf(IllegalStateException.class);
        assertThat(aggregator.snapshot().done()).isEqualTo(1);
    }

    @Test
    void finishIsIdempotentAndClosesTheRun() {
        ProgressAggregator aggregator = new ProgressAggregator(BatchKind.EXPORT, 3);
        aggregator.recordSuccess();
        aggregator.recordFailure();
        aggregator.recordSuccess();

        BatchSummary first = aggregator.finish(BatchRunState.COMPLETED);
        BatchSummary second = aggregator.finish(BatchRunState.CANCELLED);

        assertThat(second).isSameAs(first);
        assertThat(first.succeeded()).isEqualTo(2);
        assertThat(first.errors()).isEqualTo(1);
        assertThat(first.state()).isEqualTo(BatchRunState.COMPLETED);
        assertThat(first.describe()).startsWith("2/3 succeeded in ");
        assertThat(aggregator.isFinished()).isTrue();
        assertThat(aggregator.snapshot().state()).isEqualTo(BatchRunState.COMPLETED);
        assertThatThrownBy(aggregator::recordSuccess).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsRunningAsFinalState() {
        ProgressAggregator aggregator = new ProgressAggregator(BatchKind.EXPORT, 0);

        assertThatThrownBy(() -> aggregator.finish(BatchRunState.RUNNING))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void notifiesListenersAndSurvivesFailingOnes() {
        ProgressAggregator aggregator = new ProgressAggregator(BatchKind.EMBEDDING, 2);
        List<BatchProgress> seen = new ArrayList<>();
        List<BatchSummary> finished = new ArrayList<>();
        aggregator.addListener(progress -> {
            throw new IllegalStateException("listener bug");
        });
        aggregator.addListener(new ProgressListener() {
            @Override
            public void onProgress(BatchProgress progress) {
                seen.add(progress);
            }

            @Override
            public void onFinished(BatchSummary summary) {
                finished.add(summary);
            }
        });

        aggregator.recordSuccess();
        aggregator.recordFailure();
        aggregator.finish(BatchRunState.COMPLETED);

        assertThat(seen).extracting(BatchProgress::done).containsExactly(1, 2);
        assertThat(finished).hasSize(1);
    }
}
