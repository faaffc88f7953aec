package io.ipamsync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ipamsync.clients.NamClient;
import io.ipamsync.clients.http.HttpDriverFactory;
import io.ipamsync.config.SyncConfig;
import io.ipamsync.metrics.MetricsProvider;
import io.ipamsync.reconcile.FirewallAddressReconciler;
import io.ipamsync.reconcile.SecurityGroupReconciler;
import io.ipamsync.util.EnvironmentUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import static io.ipamsync.config.Constants.ENV_NAM_URL;

/**
 * Main Spring Boot application class for the IPAM firewall sync.
 *
 * Pulls prefixes for every integrator from IPAM and keeps FortiGate address objects,
 * address groups and VMware NSX security groups in line with them, either once per
 * process start or on a fixed interval.
 */
@Slf4j
@SpringBootApplication
public class IpamSyncApplication {

    public static void main(String[] args) {
        log.info("Starting IPAM firewall sync");

        try {
            SpringApplication.run(IpamSyncApplication.class, args);
        } catch (Exception e) {
            log.error("Failed to start IPAM firewall sync: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public SyncConfig syncConfig() {
        SyncConfig config = new SyncConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public HttpDriverFactory driverFactory(SyncConfig config, ObjectMapper objectMapper) {
        return new HttpDriverFactory(config, objectMapper);
    }

    /**
     * NAM directory client, one per process.
     */
    @Bean
    public NamClient namClient(SyncConfig config, HttpDriverFactory driverFactory) {
        if (EnvironmentUtils.isBlank(config.getNamUrl())) {
            throw new IllegalStateException("NAM URL is not configured, set " + ENV_NAM_URL);
        }
        return driverFactory.openDirectory(config.getNamUrl(), config.getNamToken());
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry registry, SyncConfig config) {
        return new MetricsProvider(registry, config.getHostname());
    }

    @Bean
    public FirewallAddressReconciler firewallAddressReconciler() {
        return new FirewallAddressReconciler();
    }

    @Bean
    public SecurityGroupReconciler securityGroupReconciler() {
        return new SecurityGroupReconciler();
    }

    @Bean
    public SyncWorker syncWorker(SyncConfig config, NamClient namClient, HttpDriverFactory driverFactory,
                                 FirewallAddressReconciler firewallAddressReconciler,
                                 SecurityGroupReconciler securityGroupReconciler, MetricsProvider metricsProvider) {
        log.info("Initializing SyncWorker for {} priority", config.getPriority().getValue());
        return new SyncWorker(config, namClient, driverFactory, firewallAddressReconciler, securityGroupReconciler,
            metricsProvider);
    }

    @Bean(destroyMethod = "stop")
    public SyncScheduler syncScheduler(SyncWorker worker, SyncConfig config, ApplicationContext context) {
        ExitHandler exitHandler = code -> System.exit(SpringApplication.exit(context, () -> code));
        return new SyncScheduler(worker, config, exitHandler);
    }

    @Bean
    public ApplicationRunner syncRunner(SyncScheduler scheduler) {
        return args -> scheduler.start();
    }
}
