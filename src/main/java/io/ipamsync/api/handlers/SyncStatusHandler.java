package io.ipamsync.api.handlers;

import io.ipamsync.SyncWorker;
import io.ipamsync.api.models.responses.ErrorResponse;
import io.ipamsync.api.models.responses.RunResponse;
import io.ipamsync.api.models.responses.SyncStatusResponse;
import io.ipamsync.config.SyncConfig;
import io.ipamsync.enums.RunResult;
import io.ipamsync.enums.SyncPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

/**
 * REST API handler for inspecting and triggering sync runs.
 *
 * Supported operations:
 * - GET /api/v1/sync/status - Worker state and completed run count
 * - POST /api/v1/sync/run?priority=low|medium|high - Run one sync pass synchronously
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sync")
public class SyncStatusHandler {

    private final SyncWorker worker;
    private final SyncConfig config;

    public SyncStatusHandler(SyncWorker worker, SyncConfig config) {
        this.worker = worker;
        this.config = config;
    }

    /**
     * GET /api/v1/sync/status
     */
    @GetMapping("/status")
    public ResponseEntity<Object> getStatus() {
        return ResponseEntity.ok(SyncStatusResponse.builder()
            .name(config.getSsiName())
            .running(worker.isRunning())
            .completedRuns(worker.getCompletedRuns())
            .priority(config.getPriority().getValue())
            .cronMode(config.isCronMode())
            .build());
    }

    /**
     * POST /api/v1/sync/run
     * Defaults to the configured priority.
     */
    @PostMapping("/run")
    public ResponseEntity<Object> triggerRun(@RequestParam(value = "priority", required = false) String priority) {
        SyncPriority syncPriority;
        try {
            syncPriority = priority == null ? config.getPriority() : SyncPriority.fromString(priority);
        } catch (IllegalArgumentException e) {
            log.error("Invalid sync priority '{}': {}", priority, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        }

        try {
            log.info("Manual sync run requested for {} priority", syncPriority.getValue());
            RunResult result = worker.work(syncPriority);
            if (result == RunResult.ALREADY_RUNNING) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.alreadyRunning());
            }
            return ResponseEntity.ok(RunResponse.builder()
                .result(result.name().toLowerCase(Locale.ROOT))
                .priority(syncPriority.getValue())
                .completedRuns(worker.getCompletedRuns())
                .build());
        } catch (Exception e) {
            log.error("Manual sync run failed: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
