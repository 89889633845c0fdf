package com.eyelevel.batchorchestrator.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingWorkItemTest {

    private static MediaFile png(String name) {
        return new MediaFile(name, "image/png", "pixels".getBytes(StandardCharsets.UTF_8), null);
    }

    @Test
    void walksTheHappyPathInOrder() {
        EmbeddingWorkItem item = new EmbeddingWorkItem(png("a.png"));
        assertThat(item.getStatus()).isEqualTo(EmbeddingStatus.PENDING);

        item.transitionTo(EmbeddingStatus.UPLOADING);
        item.markUploaded();
        assertThat(item.getStatus()).isEqualTo(EmbeddingStatus.PROCESSING);

        EmbedResult result = new EmbedResult("fp-1", 42.5, "/api/image/a.png", 7L, "ok", 1.2);
        item.complete(result);

        assertThat(item.getStatus()).isEqualTo(EmbeddingStatus.DONE);
        assertThat(item.isTerminal()).isTrue();
        assertThat(item.isFailed()).isFalse();
        assertThat(item.getResult()).isEqualTo(result);
    }

    @Test
    void completePassesThroughProcessingWhenUploadCallbackNeverFired() {
        EmbeddingWorkItem item = new EmbeddingWorkItem(png("a.png"));
        item.transitionTo(EmbeddingStatus.UPLOADING);

        item.complete(new EmbedResult("fp", null, null, null, null, null));

        assertThat(item.getStatus()).isEqualTo(EmbeddingStatus.DONE);
    }

    @Test
    void lateUploadCallbackIsIgnored() {
        EmbeddingWorkItem item = new EmbeddingWorkItem(png("a.png"));
        item.transitionTo(EmbeddingStatus.UPLOADING);
        item.complete(new EmbedResult("fp", null, null, null, null, null));

        item.markUploaded();

        assertThat(item.getStatus()).isEqualTo(EmbeddingStatus.DONE);
    }

    @Test
    void rejectsBackwardTransitions() {
        EmbeddingWorkItem item = new EmbeddingWorkItem(png("a.png"));
        item.transitionTo(EmbeddingStatus.UPLOADING);
        item.fail(ErrorCode.INVALID_IMAGE, ErrorCode.INVALID_IMAGE.getSummary(), QuotaDeduction.NOT_DEDUCTED);

        assertThatThrownBy(() -> item.transitionTo(EmbeddingStatus.UPLOADING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot move from error to uploading");
        assertThatThrownBy(() -> item.fail(ErrorCode.UNKNOWN, "again", QuotaDeduction.UNKNOWN))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failureKeepsCodeMessageAndQuotaFlag() {
        EmbeddingWorkItem item = new EmbeddingWorkItem(png("a.png"));
        item.transitionTo(EmbeddingStatus.UPLOADING);

        item.fail("SOMETHING_NEW", "Server said no", QuotaDeduction.DEDUCTED);

        assertThat(item.isFailed()).isTrue();
        assertThat(item.getErrorCode()).isEqualTo("SOMETHING_NEW");
        assertThat(item.getError()).isEqualTo("Server said no");
        assertThat(item.getQuotaDeducted()).isEqualTo(QuotaDeduction.DEDUCTED);
    }

    @Test
    void pendingItemCanBeFailedDirectly() {
        EmbeddingWorkItem item = new EmbeddingWorkItem(png("a.png"));

        item.fail(ErrorCode.CANCELLED, ErrorCode.CANCELLED.getSummary(), QuotaDeduction.NOT_DEDUCTED);

        assertThat(item.getStatus()).isEqualTo(EmbeddingStatus.ERROR);
    }

    @Test
    void requeueCreatesFreshPendingItemForSameFile() {
        EmbeddingWorkItem item = new EmbeddingWorkItem(png("a.png"));
        item.fail(ErrorCode.NETWORK_ERROR, "offline", QuotaDeduction.UNKNOWN);

        EmbeddingWorkItem copy = item.requeue();

        assertThat(copy.getId()).isNotEqualTo(item.getId());
        assertThat(copy.getFile()).isSameAs(item.getFile());
        assertThat(copy.getStatus()).isEqualTo(EmbeddingStatus.PENDING);
        assertThat(copy.getError()).isNull();
    }

    @Test
    void detectsVideosByContentTypeOrExtension() {
        byte[] bytes = new byte[]{1, 2, 3};
        assertThat(new MediaFile("clip.bin", "video/mp4", bytes, null).kind()).isEqualTo(MediaKind.VIDEO);
        assertThat(new MediaFile("clip.MOV", null, bytes, null).kind()).isEqualTo(MediaKind.VIDEO);
        assertThat(new MediaFile("photo.jpg", "image/jpeg", bytes, null).kind()).isEqualTo(MediaKind.IMAGE);
    }
}
