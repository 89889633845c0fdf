package com.eyelevel.batchorchestrator.client.result;

import com.eyelevel.batchorchestrator.model.QuotaDeduction;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Objects;

/**
 * Outcome of one remote call with both error channels folded in: HTTP statuses and
 * {@code success:false} bodies end up as the same {@link #isOk() not-ok} shape.
 *
 * @param <T> the success payload
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RemoteResult<T> {

    /**
     * Coarse classification a workflow branches on.
     */
    public enum ErrorKind {
        /** HTTP 402: the plan quota is spent; nothing further should be attempted. */
        QUOTA_EXHAUSTED,
        /** The server understood the request and refused it for a domain reason. */
        BUSINESS_REJECTION,
        /** 401 or 403. */
        UNAUTHORIZED,
        /** The server could not be reached or did not answer in time. */
        TRANSPORT,
        /** The server failed or answered with something unreadable. */
        SERVER;

        public boolean isRetryable() {
            return this == TRANSPORT;
        }
    }

    private final T value;
    private final ErrorKind errorKind;
    private final String code;
    private final String message;
    private final QuotaDeduction quotaDeducted;

    public static <T> RemoteResult<T> ok(T value) {
        return new RemoteResult<>(value, null, null, null, null);
    }

    public static <T> RemoteResult<T> err(ErrorKind kind, String code, String message, QuotaDeduction quotaDeducted) {
        Objects.requireNonNull(kind, "kind must not be null");
        return new RemoteResult<>(null, kind, code, message,
                                  quotaDeducted == null ? QuotaDeduction.UNKNOWN : quotaDeducted);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public boolean isQuotaExhausted() {
        return errorKind == ErrorKind.QUOTA_EXHAUSTED;
    }

    /**
     * Re-types a failure so it can be passed on from a differently typed call.
     */
    public <R> RemoteResult<R> castError() {
        if (isOk()) {
            throw new IllegalStateException("Cannot re-type a successful result");
        }
        return err(errorKind, code, message, quotaDeducted);
    }

    @Override
    public String toString() {
        return isOk() ? "RemoteResult.ok(" + value + ")"
                      : "RemoteResult.err(" + errorKind + ", " + code + ", " + message + ", " + quotaDeducted + ")";
    }
}
