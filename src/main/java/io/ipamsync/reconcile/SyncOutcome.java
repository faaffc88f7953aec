package io.ipamsync.reconcile;

import io.ipamsync.enums.OutcomeStatus;
import io.ipamsync.enums.SyncOperation;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Result of one mutation attempt against a target platform.
 */
@Data
@AllArgsConstructor
public class SyncOutcome {
    private final SyncOperation operation;
    private final String target;
    private final OutcomeStatus status;
    private final String error;

    public static SyncOutcome succeeded(SyncOperation operation, String target) {
        return new SyncOutcome(operation, target, OutcomeStatus.SUCCEEDED, null);
    }

    public static SyncOutcome failed(SyncOperation operation, String target, String error) {
        return new SyncOutcome(operation, target, OutcomeStatus.FAILED, error);
    }

    public static SyncOutcome skipped(SyncOperation operation, String target, String reason) {
        return new SyncOutcome(operation, target, OutcomeStatus.SKIPPED, reason);
    }
}
