package com.eyelevel.batchorchestrator.service.embedding;

import com.eyelevel.batchorchestrator.client.dto.UserProfile;
import com.eyelevel.batchorchestrator.client.result.RemoteOperationAdapter;
import com.eyelevel.batchorchestrator.client.result.RemoteResult;
import com.eyelevel.batchorchestrator.client.result.RemoteResult.ErrorKind;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.Authentication;
import com.eyelevel.batchorchestrator.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.batchorchestrator.config.BatchProcessingConfig;
import com.eyelevel.batchorchestrator.model.EmbedResult;
import com.eyelevel.batchorchestrator.model.EmbeddingStatus;
import com.eyelevel.batchorchestrator.model.EmbeddingWorkItem;
import com.eyelevel.batchorchestrator.model.ErrorCode;
import com.eyelevel.batchorchestrator.model.MediaFile;
import com.eyelevel.batchorchestrator.model.PlanKey;
import com.eyelevel.batchorchestrator.model.PlanPolicy;
import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import com.eyelevel.batchorchestrator.model.QuotaSnapshot;
import com.eyelevel.batchorchestrator.service.policy.PlanPolicyResolver;
import com.eyelevel.batchorchestrator.service.policy.UserProfileService;
import com.eyelevel.batchorchestrator.service.progress.BatchRunState;
import com.eyelevel.batchorchestrator.service.progress.BatchSummary;
import com.eyelevel.batchorchestrator.service.scheduler.ConcurrencyLimitedScheduler;
import com.eyelevel.batchorchestrator.service.session.ActiveBatch;
import com.eyelevel.batchorchestrator.service.session.BatchSession;
import com.eyelevel.batchorchestrator.service.session.BatchSessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingBatchServiceTest {

    private static final String SESSION = "session-1";

    @Mock
    private RemoteOperationAdapter remoteOperationAdapter;
    @Mock
    private PlanPolicyResolver planPolicyResolver;
    @Mock
    private UserProfileService userProfileService;
    @Mock
    private TaskScheduler taskScheduler;

    private final Authentication auth = new BearerTokenAuthentication("token");
    private final BatchSessionStore store = new BatchSessionStore();
    private final BatchProcessingConfig config = new BatchProcessingConfig();
    private ExecutorService executor;
    private EmbeddingBatchService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        service = new EmbeddingBatchService(store, new ConcurrencyLimitedScheduler(executor), remoteOperationAdapter,
                                            planPolicyResolver, userProfileService, config, taskScheduler);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static MediaFile png(String name) {
        return new MediaFile(name, "image/png", new byte[]{1, 2, 3}, null);
    }

    private static List<MediaFile> files(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> png("file-" + i + ".png")).toList();
    }

    private static RemoteResult<EmbedResult> embedded(String name) {
        return RemoteResult.ok(new EmbedResult("fp-" + name, 42.0, "/dl/" + name, 1L, "ok", 0.5));
    }

    private BatchSummary awaitSummary(ActiveBatch batch) {
        return batch.getCompletion().orTimeout(10, TimeUnit.SECONDS).join();
    }

    @Test
    void oneRejectedFileDoesNotStopTheOthers() {
        when(planPolicyResolver.resolveForUser(auth)).thenReturn(new PlanPolicy(PlanKey.FREE, 2, 10));
        when(remoteOperationAdapter.embed(eq(auth), any(), anyDouble(), any(), any())).thenAnswer(invocation -> {
            MediaFile file = invocation.getArgument(1);
            if (file.fileName().equals("file-3.png")) {
                return RemoteResult.err(ErrorKind.BUSINESS_REJECTION, "INVALID_IMAGE",
                                        ErrorCode.INVALID_IMAGE.getSummary(), QuotaDeduction.NOT_DEDUCTED);
            }
            return embedded(file.fileName());
        });
        List<EmbeddingWorkItem> items = service.enqueue(SESSION, files(5));

        BatchSummary summary = awaitSummary(service.start(SESSION, auth, new EmbeddingOptions(null, "alice")));

        assertThat(summary.total()).isEqualTo(5);
        assertThat(summary.succeeded()).isEqualTo(4);
        assertThat(summary.errors()).isEqualTo(1);
        assertThat(summary.state()).isEqualTo(BatchRunState.COMPLETED);
        assertThat(items.get(2).getStatus()).isEqualTo(EmbeddingStatus.ERROR);
        assertThat(items.get(2).getErrorCode()).isEqualTo("INVALID_IMAGE");
        assertThat(items).filteredOn(item -> item.getStatus() == EmbeddingStatus.DONE).hasSize(4)
                         .allSatisfy(item -> assertThat(item.getResult().fingerprint()).startsWith("fp-"));
        verify(remoteOperationAdapter, times(5)).embed(eq(auth), any(), eq(0.1), eq("alice"), any());
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void quotaExhaustionHaltsTheBatchAndSparesQueuedFiles() {
        when(planPolicyResolver.resolveForUser(auth)).thenReturn(new PlanPolicy(PlanKey.FREE, 1, 10));
        when(remoteOperationAdapter.embed(eq(auth), any(), anyDouble(), any(), any()))
                .thenReturn(embedded("file-1.png"))
                .thenReturn(RemoteResult.err(ErrorKind.QUOTA_EXHAUSTED, "QUOTA_EXHAUSTED",
                                             ErrorCode.QUOTA_EXHAUSTED.getSummary(), QuotaDeduction.NOT_DEDUCTED));
        List<EmbeddingWorkItem> items = service.enqueue(SESSION, files(4));

        BatchSummary summary = awaitSummary(service.start(SESSION, auth, new EmbeddingOptions(0.3, null)));

        assertThat(summary.state()).isEqualTo(BatchRunState.HALTED);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.errors()).isEqualTo(3);
        assertThat(items.get(0).getStatus()).isEqualTo(EmbeddingStatus.DONE);
        assertThat(items.subList(1, 4)).allSatisfy(item -> {
            assertThat(item.getStatus()).isEqualTo(EmbeddingStatus.ERROR);
            assertThat(item.getErrorCode()).isEqualTo(ErrorCode.QUOTA_EXHAUSTED.getValue());
            assertThat(item.getQuotaDeducted()).isEqualTo(QuotaDeduction.NOT_DEDUCTED);
        });
        verify(remoteOperationAdapter, times(2)).embed(eq(auth), any(), eq(0.3), any(), any());
    }

    @Test
    void noQuotaRefreshWhenNothingSucceeded() {
        config.getQuotaRefresh().setEnabled(true);
        when(planPolicyResolver.resolveForUser(auth)).thenReturn(new PlanPolicy(PlanKey.PRO, 5, null));
        when(remoteOperationAdapter.embed(eq(auth), any(), anyDouble(), any(), any()))
                .thenReturn(RemoteResult.err(ErrorKind.TRANSPORT, "NETWORK_ERROR", "Network error, please retry.",
                                             QuotaDeduction.UNKNOWN));
        service.enqueue(SESSION, files(2));

        BatchSummary summary = awaitSummary(service.start(SESSION, auth, new EmbeddingOptions(null, null)));

        assertThat(summary.errors()).isEqualTo(2);
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void requeueReplacesFailedItemsWithFreshPendingOnes() {
        when(planPolicyResolver.resolveForUser(auth)).thenReturn(new PlanPolicy(PlanKey.FREE, 2, 10));
        when(remoteOperationAdapter.embed(eq(auth), any(), anyDouble(), any(), any()))
                .thenReturn(RemoteResult.err(ErrorKind.SERVER, "EMBED_FAILED", ErrorCode.EMBED_FAILED.getSummary(),
                                             QuotaDeduction.UNKNOWN));
        List<EmbeddingWorkItem> original = service.enqueue(SESSION, files(1));
        awaitSummary(service.start(SESSION, auth, new EmbeddingOptions(null, null)));

        List<EmbeddingWorkItem> requeued = service.requeueFailed(SESSION);

        assertThat(requeued).hasSize(1);
        assertThat(requeued.get(0).getId()).isNotEqualTo(original.get(0).getId());
        assertThat(requeued.get(0).getStatus()).isEqualTo(EmbeddingStatus.PENDING);
        assertThat(requeued.get(0).getFile()).isSameAs(original.get(0).getFile());
        assertThat(service.list(SESSION)).containsExactlyElementsOf(requeued);
    }

    @Test
    void finishedItemsCanBeClearedAndPendingOnesRemoved() {
        when(planPolicyResolver.resolveForUser(auth)).thenReturn(new PlanPolicy(PlanKey.FREE, 2, 10));
        when(remoteOperationAdapter.embed(eq(auth), any(), anyDouble(), any(), any()))
                .thenReturn(embedded("file-1.png"));
        service.enqueue(SESSION, files(1));
        awaitSummary(service.start(SESSION, auth, new EmbeddingOptions(null, null)));
        List<EmbeddingWorkItem> queued = service.enqueue(SESSION, List.of(png("later.png"), png("other.png")));

        assertThat(service.clearFinished(SESSION)).isEqualTo(1);
        assertThat(service.remove(SESSION, queued.get(0).getId())).isTrue();
        assertThat(service.remove(SESSION, "no-such-item")).isFalse();
        assertThat(service.list(SESSION)).containsExactly(queued.get(1));
    }

    @Test
    void cancelWithoutARunningBatchReturnsFalse() {
        service.enqueue(SESSION, files(1));

        assertThat(service.cancel(SESSION)).isFalse();
    }

    @Test
    void quotaRefreshStoresTheLatestSnapshot() {
        BatchSession session = store.getOrCreate(SESSION);
        UserProfile profile = new UserProfile("u-1", "alice", "user", "Alice", "personal", 3, 50, 12, 30, "active");
        when(userProfileService.fetchProfile(auth)).thenReturn(Optional.of(profile));

        service.refreshQuota(session, auth);

        assertThat(session.getQuotaSnapshot().plan()).isEqualTo(PlanKey.PERSONAL);
        assertThat(session.getQuotaSnapshot().quotaUsed()).isEqualTo(12);
        assertThat(session.getQuotaSnapshot().quotaTotal()).isEqualTo(30);
    }

    @Test
    void failedQuotaRefreshKeepsThePreviousSnapshot() {
        BatchSession session = store.getOrCreate(SESSION);
        QuotaSnapshot previous = new QuotaSnapshot(PlanKey.FREE, 1, 10, Instant.now());
        session.setQuotaSnapshot(previous);
        when(userProfileService.fetchProfile(auth)).thenThrow(new IllegalStateException("down"));

        service.refreshQuota(session, auth);

        assertThat(session.getQuotaSnapshot()).isEqualTo(previous);
    }
}
