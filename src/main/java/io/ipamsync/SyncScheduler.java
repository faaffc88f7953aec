package io.ipamsync;

import io.ipamsync.config.SyncConfig;
import io.ipamsync.enums.RunResult;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.ipamsync.config.Constants.EXIT_CODE_FAILURE;

/**
 * Drives the worker either once (exiting the process afterwards) or on a fixed delay.
 */
@Slf4j
public class SyncScheduler {

    private final SyncWorker worker;
    private final SyncConfig config;
    private final ExitHandler exitHandler;
    private final ScheduledExecutorService scheduler;
    private volatile boolean started = false;

    public SyncScheduler(SyncWorker worker, SyncConfig config, ExitHandler exitHandler) {
        this.worker = worker;
        this.config = config;
        this.exitHandler = exitHandler;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("sync-scheduler-" + t.getId());
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (started) {
            log.warn("Sync scheduler already started");
            return;
        }
        started = true;
        if (config.isCronMode()) {
            log.info("Starting {} in continuous mode, {} priority every {}s", config.getSsiName(),
                config.getPriority().getValue(), config.getIntervalSeconds());
            scheduler.scheduleWithFixedDelay(this::runScheduled, 0, config.getIntervalSeconds(), TimeUnit.SECONDS);
        } else {
            log.info("Starting {} in one-shot mode, {} priority", config.getSsiName(), config.getPriority().getValue());
            scheduler.execute(this::runOnce);
        }
    }

    /**
     * One pass, then exit with the pass's code. The exit is delayed by the request timeout
     * so that pending log output is flushed.
     */
    void runOnce() {
        int exitCode;
        try {
            RunResult result = worker.work(config.getPriority());
            exitCode = result.getExitCode();
        } catch (RuntimeException e) {
            log.error("Sync run failed: {}", e.getMessage(), e);
            exitCode = EXIT_CODE_FAILURE;
        }
        final int code = exitCode;
        log.info("Exiting with code {} in {}ms", code, config.getRequestTimeoutMs());
        scheduler.schedule(() -> exitHandler.exit(code), config.getRequestTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * One scheduled pass. Errors are logged so that the schedule keeps running.
     */
    void runScheduled() {
        try {
            RunResult result = worker.work(config.getPriority());
            log.debug("Scheduled sync run finished: {}", result);
        } catch (RuntimeException e) {
            log.error("Scheduled sync run failed: {}", e.getMessage(), e);
        }
    }

    public void stop() {
        log.info("Stopping sync scheduler");
        scheduler.shutdownNow();
    }

    public boolean isStarted() {
        return started;
    }
}
