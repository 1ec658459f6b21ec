package com.foreman.core.state;

import java.time.Instant;

/**
 * Selects what a rollback restores: the state captured before a transaction, a snapshot,
 * or the state just before a point in time. Exactly one selector must be given.
 */
public final class RollbackTarget {

    private final String transactionId;
    private final String snapshotId;
    private final Instant restoreAt;

    /**
     * @throws IllegalArgumentException unless exactly one argument is non-null
     */
    public RollbackTarget(String transactionId, String snapshotId, Instant restoreAt) {
        int provided = (transactionId != null ? 1 : 0) + (snapshotId != null ? 1 : 0) + (restoreAt != null ? 1 : 0);
        if (provided != 1) {
            throw new IllegalArgumentException(
                    "Exactly one of transactionId, snapshotId or restoreAt must be provided (got " + provided + ")");
        }
        this.transactionId = transactionId;
        this.snapshotId = snapshotId;
        this.restoreAt = restoreAt;
    }

    public static RollbackTarget transaction(String transactionId) {
        return new RollbackTarget(transactionId, null, null);
    }

    public static RollbackTarget snapshot(String snapshotId) {
        return new RollbackTarget(null, snapshotId, null);
    }

    public static RollbackTarget restoreAt(Instant restoreAt) {
        return new RollbackTarget(null, null, restoreAt);
    }

    public String transactionId() {
        return transactionId;
    }

    public String snapshotId() {
        return snapshotId;
    }

    public Instant restoreAt() {
        return restoreAt;
    }

    /** Metric tag for the selector in use. */
    public String selector() {
        if (transactionId != null) {
            return "transaction";
        }
        return snapshotId != null ? "snapshot" : "timestamp";
    }

    @Override
    public String toString() {
        return "RollbackTarget[" + selector() + "=" +
                (transactionId != null ? transactionId : snapshotId != null ? snapshotId : restoreAt) + "]";
    }
}
