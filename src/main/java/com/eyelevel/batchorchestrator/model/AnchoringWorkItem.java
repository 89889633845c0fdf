package com.eyelevel.batchorchestrator.model;

import lombok.Getter;

import java.util.UUID;

/**
 * An existing server-side asset queued for blockchain anchoring.
 *
 * <p>The item is updated in two explicit phases: {@link #applyOptimistic(AnchorReceipt)} from the
 * anchor response itself, then {@link #reconcile(AnchorReceipt)} from an authoritative asset fetch.
 * An item can end {@code ANCHORED} without a transaction hash when the server accepted the request
 * but confirmation did not arrive before polling ran out; its badge then stays {@code PENDING} until
 * a later reconciliation fills the hash in.
 */
@Getter
public class AnchoringWorkItem extends WorkItem<AnchoringStatus> {

    private final Long assetId;
    private volatile AnchorReceipt receipt;

    /**
     * @param assetId  the server asset id; {@code null} rows are kept so they can be reported as failed.
     * @param fileName display name of the asset.
     */
    public AnchoringWorkItem(Long assetId, String fileName) {
        super(assetId == null ? "missing-" + UUID.randomUUID() : String.valueOf(assetId), fileName,
                AnchoringStatus.PENDING);
        this.assetId = assetId;
    }

    @Override
    protected AnchoringStatus errorStatus() {
        return AnchoringStatus.ERROR;
    }

    /**
     * Applies what the anchor call returned. A response that already carries a transaction hash
     * finishes the item; an accepted-but-unconfirmed one leaves it {@code ANCHORING} for polling.
     */
    public synchronized void applyOptimistic(AnchorReceipt optimistic) {
        if (optimistic == null) {
            return;
        }
        this.receipt = optimistic;
        if (optimistic.isConfirmed() && getStatus() == AnchoringStatus.ANCHORING) {
            transitionTo(AnchoringStatus.ANCHORED);
        }
    }

    /**
     * Finishes an item whose anchor was accepted but whose confirmation never showed up while
     * polling. The last optimistic state is kept.
     */
    public synchronized void settleUnconfirmed() {
        if (getStatus() == AnchoringStatus.ANCHORING) {
            transitionTo(AnchoringStatus.ANCHORED);
        }
    }

    /**
     * Applies the authoritative state of the asset. Only a confirmed receipt changes anything:
     * the server never reports an anchor as un-done, so an absent hash is not evidence of failure.
     *
     * @return {@code true} if the item changed.
     */
    public synchronized boolean reconcile(AnchorReceipt authoritative) {
        if (authoritative == null || !authoritative.isConfirmed()) {
            return false;
        }
        if (getStatus() == AnchoringStatus.ANCHORED && receipt != null && receipt.equals(authoritative)) {
            return false;
        }
        this.receipt = authoritative;
        if (getStatus() != AnchoringStatus.ANCHORED) {
            clearError();
            overrideStatus(AnchoringStatus.ANCHORED);
        }
        return true;
    }

    public boolean isConfirmed() {
        AnchorReceipt current = receipt;
        return current != null && current.isConfirmed();
    }

    public AnchorBadge badge() {
        if (isFailed()) {
            return AnchorBadge.FAILED;
        }
        return getStatus() == AnchoringStatus.ANCHORED && isConfirmed() ? AnchorBadge.CONFIRMED : AnchorBadge.PENDING;
    }
}
