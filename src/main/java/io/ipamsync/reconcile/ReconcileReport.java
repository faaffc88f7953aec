package io.ipamsync.reconcile;

import io.ipamsync.enums.OutcomeStatus;
import io.ipamsync.enums.SyncOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe collector of the outcomes of one reconciliation unit (a vdom and address family,
 * or one security platform endpoint). Reports of concurrent units are merged by the worker.
 */
public class ReconcileReport {

    private final String unit;
    private final List<SyncOutcome> outcomes = new CopyOnWriteArrayList<>();
    private final AtomicInteger abortedUnits = new AtomicInteger(0);

    public ReconcileReport(String unit) {
        this.unit = unit;
    }

    public static ReconcileReport aborted(String unit) {
        ReconcileReport report = new ReconcileReport(unit);
        report.markAborted();
        return report;
    }

    public String getUnit() {
        return unit;
    }

    public void record(SyncOutcome outcome) {
        outcomes.add(outcome);
    }

    public void succeeded(SyncOperation operation, String target) {
        record(SyncOutcome.succeeded(operation, target));
    }

    public void failed(SyncOperation operation, String target, String error) {
        record(SyncOutcome.failed(operation, target, error));
    }

    public void skipped(SyncOperation operation, String target, String reason) {
        record(SyncOutcome.skipped(operation, target, reason));
    }

    /**
     * Marks the unit as not reconciled because its observed state could not be fetched.
     */
    public void markAborted() {
        abortedUnits.incrementAndGet();
    }

    public boolean isAborted() {
        return abortedUnits.get() > 0;
    }

    public int getAbortedUnits() {
        return abortedUnits.get();
    }

    public List<SyncOutcome> getOutcomes() {
        return new ArrayList<>(outcomes);
    }

    public long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public long count(SyncOperation operation, OutcomeStatus status) {
        return outcomes.stream()
            .filter(o -> o.getOperation() == operation && o.getStatus() == status)
            .count();
    }

    public ReconcileReport merge(ReconcileReport other) {
        outcomes.addAll(other.outcomes);
        abortedUnits.addAndGet(other.abortedUnits.get());
        return this;
    }

    @Override
    public String toString() {
        return String.format("%s: %d succeeded, %d failed, %d skipped, %d aborted",
            unit, count(OutcomeStatus.SUCCEEDED), count(OutcomeStatus.FAILED),
            count(OutcomeStatus.SKIPPED), abortedUnits.get());
    }
}
