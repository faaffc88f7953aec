package io.ipamsync.metrics;

/**
 * Constants for metrics names and tags used by the sync worker.
 */
public class MetricsConstants {
    public final static String OPERATIONS_METRIC_NAME = "ipamsync.operations";
    public final static String RUNS_METRIC_NAME = "ipamsync.runs";
    public final static String SCOPE_SKIPPED_METRIC_NAME = "ipamsync.scope.skipped";
    public final static String RUN_DURATION_METRIC_NAME = "ipamsync.run.duration";
    public final static String INTEGRATORS_PROCESSED_METRIC_NAME = "ipamsync.integrators.processed";
    public final static String OPERATION_TAG = "operation";
    public final static String STATUS_TAG = "status";
    public final static String RESULT_TAG = "result";
    public final static String PRIORITY_TAG = "priority";
    public final static String RESULT_FAILED = "failed";

    private MetricsConstants() {}
}
