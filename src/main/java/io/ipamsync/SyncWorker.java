package io.ipamsync;

import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.DriverFactory;
import io.ipamsync.clients.FortiOSClient;
import io.ipamsync.clients.NamClient;
import io.ipamsync.clients.NetboxClient;
import io.ipamsync.clients.NsxClient;
import io.ipamsync.config.SyncConfig;
import io.ipamsync.enums.AddressFamily;
import io.ipamsync.enums.OutcomeStatus;
import io.ipamsync.enums.RunResult;
import io.ipamsync.enums.SyncOperation;
import io.ipamsync.enums.SyncPriority;
import io.ipamsync.metrics.MetricsProvider;
import io.ipamsync.models.ApiEndpoint;
import io.ipamsync.models.FirewallAddress;
import io.ipamsync.models.FortigateEndpoint;
import io.ipamsync.models.Integrator;
import io.ipamsync.models.NetboxPrefix;
import io.ipamsync.models.SecurityGroup;
import io.ipamsync.models.Vdom;
import io.ipamsync.projection.PrefixMapper;
import io.ipamsync.reconcile.FirewallAddressReconciler;
import io.ipamsync.reconcile.ReconcileReport;
import io.ipamsync.reconcile.SecurityGroupReconciler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.ipamsync.config.Constants.NSX_GLOBAL_MANAGER_TYPE;
import static io.ipamsync.metrics.MetricsConstants.*;

/**
 * Runs one sync pass over the integrators of a priority class.
 *
 * <p>Only one pass runs at a time per worker; a request while a pass is active returns
 * {@link RunResult#ALREADY_RUNNING} without touching anything. Integrators are processed one
 * after another. The vdoms of one FortiGate are reconciled concurrently (both families each)
 * on a bounded pool, sharing the FortiGate handle. Security platform endpoints are processed
 * sequentially.
 *
 * <p>Failures are contained to the smallest unit: a vdom, an endpoint, or an integrator.
 * Only a failed integrator lookup, or an unexpected error outside the integrator loop,
 * aborts the pass with a {@link SyncException}.
 */
@Slf4j
public class SyncWorker {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final SyncConfig config;
    private final NamClient namClient;
    private final DriverFactory driverFactory;
    private final FirewallAddressReconciler firewallReconciler;
    private final SecurityGroupReconciler securityGroupReconciler;
    private final MetricsProvider metricsProvider;
    private final ExecutorService fanOutExecutor;

    private final RunState state = new RunState();
    private final AtomicInteger completedRuns = new AtomicInteger(0);

    public SyncWorker(SyncConfig config, NamClient namClient, DriverFactory driverFactory,
                      FirewallAddressReconciler firewallReconciler, SecurityGroupReconciler securityGroupReconciler,
                      MetricsProvider metricsProvider) {
        this.config = config;
        this.namClient = namClient;
        this.driverFactory = driverFactory;
        this.firewallReconciler = firewallReconciler;
        this.securityGroupReconciler = securityGroupReconciler;
        this.metricsProvider = metricsProvider;
        this.fanOutExecutor = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), r -> {
            Thread t = new Thread(r);
            t.setName("sync-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        });
        log.info("SyncWorker initialized: name={}, workerThreads={}, diagnosticMode={}",
            config.getSsiName(), config.getWorkerThreads(), config.isDiagnosticMode());
    }

    /**
     * Run one sync pass.
     *
     * @return {@link RunResult#COMPLETED}, or {@link RunResult#ALREADY_RUNNING} if a pass is in progress
     * @throws SyncException if the pass was aborted
     */
    public RunResult work(SyncPriority priority) {
        if (!state.running.compareAndSet(false, true)) {
            log.warn("Worker task already running...");
            metricsProvider.counter(RUNS_METRIC_NAME, Map.of(RESULT_TAG, "already_running")).increment();
            return RunResult.ALREADY_RUNNING;
        }

        long startNanos = System.nanoTime();
        boolean completed = false;
        try {
            log.debug("Starting sync of {} priority integrators", priority.getValue());
            List<Integrator> integrators = resolveIntegrators(priority);
            int processed = 0;
            for (Integrator integrator : integrators) {
                if (integrator == null) {
                    continue;
                }
                if (!integrator.isEnabled() && !config.isDiagnosticMode()) {
                    if (config.isDevMode()) {
                        log.debug("Skipping disabled integrator '{}'...", integrator.getName());
                    }
                    continue;
                }
                try {
                    ReconcileReport report = processIntegrator(integrator);
                    recordReport(report);
                    log.debug("Integrator '{}' done - {}", integrator.getName(), report);
                    processed++;
                } catch (RuntimeException e) {
                    log.error("Unexpected error processing integrator '{}': {}", integrator.getName(),
                        e.getMessage(), e);
                }
            }
            metricsProvider.gauge(INTEGRATORS_PROCESSED_METRIC_NAME, Map.of(PRIORITY_TAG, priority.getValue()))
                .set(processed);
            completed = true;
        } catch (SyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SyncException("Sync run aborted: " + e.getMessage(), e);
        } finally {
            state.releaseHandles();
            state.running.set(false);
            metricsProvider.timer(RUN_DURATION_METRIC_NAME, Map.of(PRIORITY_TAG, priority.getValue()))
                .record(Duration.ofNanos(System.nanoTime() - startNanos));
            metricsProvider.counter(RUNS_METRIC_NAME,
                Map.of(RESULT_TAG, completed ? "completed" : RESULT_FAILED)).increment();
        }

        int runNumber = completedRuns.incrementAndGet();
        log.debug("Worker task completed...");
        log.info("Completed run number {}", runNumber);
        return RunResult.COMPLETED;
    }

    public boolean isRunning() {
        return state.running.get();
    }

    public int getCompletedRuns() {
        return completedRuns.get();
    }

    private List<Integrator> resolveIntegrators(SyncPriority priority) {
        if (config.isDiagnosticMode()) {
            String testId = config.getTestIntegratorId();
            log.info("Diagnostic mode, processing only test integrator {}", testId);
            try {
                Integrator integrator = namClient.getIntegrator(testId);
                List<Integrator> integrators = new ArrayList<>();
                if (integrator != null) {
                    integrators.add(integrator);
                }
                return integrators;
            } catch (ApiException e) {
                log.error("Failed fetching test integrator {} on {}: {}", testId, config.getHostname(), e.getMessage());
                throw new SyncException("Failed fetching test integrator " + testId, e);
            }
        }
        try {
            return namClient.getIntegrators(priority);
        } catch (ApiException e) {
            log.error("Failed fetching integrators on {}: {}", config.getHostname(), e.getMessage());
            throw new SyncException("Failed fetching " + priority.getValue() + " priority integrators", e);
        }
    }

    private ReconcileReport processIntegrator(Integrator integrator) {
        ReconcileReport report = new ReconcileReport(integrator.getName());

        NetboxClient ipam;
        try {
            ipam = state.openIpam(driverFactory, integrator.getNetboxEndpoint());
        } catch (IllegalArgumentException e) {
            log.error("Invalid IPAM endpoint configured for '{}': {}", integrator.getName(), e.getMessage());
            return report;
        }

        if (config.isDevMode()) {
            log.debug("Preparing IP prefix(es) from IPAM...");
        }
        List<NetboxPrefix> prefixes;
        try {
            prefixes = ipam.getPrefixes(integrator.getQuery());
        } catch (ApiException e) {
            log.warn("Could not retrieve prefixes from IPAM {} due to {}", ipam.getHostname(), e.getMessage());
            log.info("Skipping due to missing prefixes for '{}'...", integrator.getName());
            return report;
        }

        List<FirewallAddress> addresses = PrefixMapper.project(prefixes, AddressFamily.IPV4);
        List<FirewallAddress> addresses6 = PrefixMapper.project(prefixes, AddressFamily.IPV6);
        log.debug("Integrator '{}': {} prefixes, {} IPv4 and {} IPv6 addresses", integrator.getName(),
            prefixes.size(), addresses.size(), addresses6.size());

        if (integrator.isFirewallSyncRequested()) {
            if (config.isDevMode()) {
                log.debug("Deploying to firewall(s)...");
            }
            report.merge(deployToFirewalls(integrator, addresses, addresses6));
        }

        if (integrator.isSecurityGroupSyncRequested()) {
            if (config.isDevMode()) {
                log.debug("Deploying to VMware NSX(es)...");
            }
            report.merge(deployToSecurityPlatforms(integrator, prefixes));
        }
        return report;
    }

    private ReconcileReport deployToFirewalls(Integrator integrator, List<FirewallAddress> addresses,
                                              List<FirewallAddress> addresses6) {
        ReconcileReport report = new ReconcileReport(integrator.getName() + "/firewalls");
        for (FortigateEndpoint fortigate : integrator.getFortigateEndpoints()) {
            if (fortigate == null || fortigate.getEndpoint() == null
                || fortigate.getVdoms() == null || fortigate.getVdoms().isEmpty()) {
                log.warn("Invalid Fortigate endpoint configured for '{}'. Check your configuration in NAM.",
                    integrator.getName());
                continue;
            }
            ApiEndpoint endpoint = fortigate.getEndpoint();
            if (!endpoint.isEnabled()) {
                log.debug("Skipping disabled Fortigate endpoint '{}' for '{}'", endpoint.getName(),
                    integrator.getName());
                continue;
            }

            FortiOSClient firewall;
            try {
                firewall = state.openFirewall(driverFactory, endpoint);
            } catch (IllegalArgumentException e) {
                log.error("Invalid Fortigate endpoint '{}' configured for '{}': {}", endpoint.getName(),
                    integrator.getName(), e.getMessage());
                continue;
            }

            List<CompletableFuture<ReconcileReport>> tasks = new ArrayList<>();
            for (Vdom vdom : fortigate.getVdoms()) {
                if (vdom == null || vdom.getName() == null) {
                    log.warn("Skipping unnamed vdom on '{}' for '{}'", firewall.getHostname(), integrator.getName());
                    continue;
                }
                tasks.add(reconcileAsync(firewall, vdom, integrator, AddressFamily.IPV4, addresses));
                tasks.add(reconcileAsync(firewall, vdom, integrator, AddressFamily.IPV6, addresses6));
            }
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<ReconcileReport> task : tasks) {
                report.merge(task.join());
            }
        }
        return report;
    }

    private CompletableFuture<ReconcileReport> reconcileAsync(FortiOSClient firewall, Vdom vdom, Integrator integrator,
                                                              AddressFamily family, List<FirewallAddress> desired) {
        String unit = firewall.getHostname() + "/" + vdom.getName() + "/" + family.getLabel();
        return CompletableFuture
            .supplyAsync(() -> firewallReconciler.reconcileAddresses(firewall, vdom, integrator, family, desired),
                fanOutExecutor)
            .exceptionally(e -> {
                log.error("Unexpected error reconciling {} addresses from '{}' on '{}' vdom '{}': {}",
                    family.getLabel(), integrator.getName(), firewall.getHostname(), vdom.getName(),
                    e.getMessage(), e);
                return ReconcileReport.aborted(unit);
            });
    }

    private ReconcileReport deployToSecurityPlatforms(Integrator integrator, List<NetboxPrefix> prefixes) {
        ReconcileReport report = new ReconcileReport(integrator.getName() + "/nsx");
        SecurityGroup desired = securityGroupReconciler.buildSecurityGroup(integrator, prefixes);
        for (ApiEndpoint endpoint : integrator.getNsxEndpoints()) {
            if (endpoint == null) {
                log.warn("Invalid NSX endpoint configured for '{}'. Check your configuration in NAM.",
                    integrator.getName());
                continue;
            }
            NsxClient nsx;
            try {
                nsx = state.openNsx(driverFactory, endpoint);
            } catch (IllegalArgumentException e) {
                log.error("Invalid NSX endpoint '{}' configured for '{}': {}", endpoint.getName(),
                    integrator.getName(), e.getMessage());
                continue;
            }
            boolean globalManager = NSX_GLOBAL_MANAGER_TYPE.equals(endpoint.getType());
            report.merge(securityGroupReconciler.reconcileSecurityGroup(nsx, integrator, desired, prefixes,
                globalManager));
        }
        return report;
    }

    private void recordReport(ReconcileReport report) {
        for (SyncOperation operation : SyncOperation.values()) {
            for (OutcomeStatus status : OutcomeStatus.values()) {
                long count = report.count(operation, status);
                if (count > 0) {
                    metricsProvider.counter(OPERATIONS_METRIC_NAME, Map.of(
                        OPERATION_TAG, operation.name().toLowerCase(Locale.ROOT),
                        STATUS_TAG, status.name().toLowerCase(Locale.ROOT))).increment(count);
                }
            }
        }
        if (report.getAbortedUnits() > 0) {
            metricsProvider.counter(SCOPE_SKIPPED_METRIC_NAME, Map.of()).increment(report.getAbortedUnits());
        }
    }

    /**
     * Stop the fan-out pool. Called on application shutdown.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SyncWorker");
        fanOutExecutor.shutdown();
        try {
            if (!fanOutExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Sync worker pool did not terminate in time, forcing shutdown");
                fanOutExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fanOutExecutor.shutdownNow();
        }
    }

    /**
     * Single-flight flag and the driver handles of the current pass. One handle of each kind
     * is open at a time; opening the next one closes the previous.
     */
    static class RunState {
        final AtomicBoolean running = new AtomicBoolean(false);
        private NetboxClient ipam;
        private FortiOSClient firewall;
        private NsxClient nsx;

        NetboxClient openIpam(DriverFactory factory, ApiEndpoint endpoint) {
            closeIpam();
            ipam = factory.openIpam(endpoint);
            return ipam;
        }

        FortiOSClient openFirewall(DriverFactory factory, ApiEndpoint endpoint) {
            closeFirewall();
            firewall = factory.openFirewall(endpoint);
            return firewall;
        }

        NsxClient openNsx(DriverFactory factory, ApiEndpoint endpoint) {
            closeNsx();
            nsx = factory.openSecurityPlatform(endpoint);
            return nsx;
        }

        void releaseHandles() {
            closeIpam();
            closeFirewall();
            closeNsx();
        }

        private void closeIpam() {
            if (ipam != null) {
                closeQuietly("IPAM", ipam::close);
                ipam = null;
            }
        }

        private void closeFirewall() {
            if (firewall != null) {
                closeQuietly("firewall", firewall::close);
                firewall = null;
            }
        }

        private void closeNsx() {
            if (nsx != null) {
                closeQuietly("NSX", nsx::close);
                nsx = null;
            }
        }

        private static void closeQuietly(String kind, Runnable closer) {
            try {
                closer.run();
            } catch (RuntimeException e) {
                log.warn("Failed to close {} handle: {}", kind, e.getMessage());
            }
        }
    }
}
