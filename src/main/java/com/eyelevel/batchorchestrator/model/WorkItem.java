package com.eyelevel.batchorchestrator.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;

/**
 * One unit of work in a batch, independent of the transport used to perform it.
 *
 * <p>Identity is the {@link #getId() id} alone. Status only ever moves forward along the machine
 * defined by {@code S}; once terminal it does not change again within a batch run. Mutators are
 * synchronized because a worker thread and a transport callback thread may touch the same item.
 *
 * @param <S> the status machine of the concrete item
 */
@Slf4j
@Getter
public abstract class WorkItem<S extends Enum<S> & ItemStatus<S>> {

    private final String id;
    private final String name;
    private volatile S status;
    private volatile String error;
    private volatile String errorCode;
    private volatile QuotaDeduction quotaDeducted = QuotaDeduction.UNKNOWN;
    private volatile Instant updatedAt;

    protected WorkItem(String id, String name, S initialStatus) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = name == null ? "" : name;
        this.status = Objects.requireNonNull(initialStatus, "initialStatus must not be null");
        this.updatedAt = Instant.now();
    }

    /**
     * @return the failure terminal of this item's machine.
     */
    protected abstract S errorStatus();

    /**
     * Moves the item to {@code next}.
     *
     * @throws IllegalStateException if the machine does not allow the transition.
     */
    public synchronized void transitionTo(S next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Work item '%s' cannot move from %s to %s", id,
                    status.getValue(), next.getValue()));
        }
        log.trace("Work item '{}' moved {} -> {}", id, status.getValue(), next.getValue());
        status = next;
        updatedAt = Instant.now();
    }

    /**
     * Moves the item to its failure terminal and records why.
     *
     * @param errorCode     the stable taxonomy tag, or a raw remote code the client does not know.
     * @param message       the user-facing message.
     * @param quotaDeducted whether the failed attempt still consumed quota.
     */
    public synchronized void fail(String errorCode, String message, QuotaDeduction quotaDeducted) {
        transitionTo(errorStatus());
        this.errorCode = errorCode;
        this.error = message;
        this.quotaDeducted = quotaDeducted == null ? QuotaDeduction.UNKNOWN : quotaDeducted;
    }

    public synchronized void fail(ErrorCode errorCode, String message, QuotaDeduction quotaDeducted) {
        fail(errorCode.getValue(), message, quotaDeducted);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isFailed() {
        return status.isFailure();
    }

    /**
     * Overwrites the status without the forward-only check. Reserved for reconciliation against a
     * fresh authoritative fetch after the scheduler has finished with the item.
     */
    protected synchronized void overrideStatus(S authoritative) {
        log.debug("Work item '{}' reconciled {} -> {}", id, status.getValue(), authoritative.getValue());
        status = authoritative;
        updatedAt = Instant.now();
    }

    protected synchronized void clearError() {
        error = null;
        errorCode = null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id.equals(((WorkItem<?>) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', name='" + name + "', status=" + status.getValue() + "}";
    }
}
