package io.ipamsync.config;

import io.ipamsync.enums.SyncPriority;
import io.ipamsync.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

import static io.ipamsync.config.Constants.*;

/**
 * Configuration for the sync service.
 * Loads the {@code ssi} section of application.yml, then applies environment variable overrides
 * (same names as the container deployment), then falls back to constants.
 */
@Slf4j
@Getter
public class SyncConfig {

    private final String ssiName;
    private final SyncPriority priority;
    private final long intervalSeconds;
    private final boolean cronMode;
    private final long requestTimeoutMs;
    private final int workerThreads;
    private final String environment;
    private final String namUrl;
    private final String namToken;
    private final String testIntegratorId;
    private final String hostname;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    public SyncConfig() {
        this(name -> EnvironmentUtils.getEnv(name, null), DEFAULT_CONFIG_FILE_CLASSPATH);
    }

    SyncConfig(Function<String, String> env, String classpathResource) {
        ConfigModel config = loadYamlConfig(env.apply(ENV_CONFIG_FILE), classpathResource);
        Ssi ssi = config.getSsi() != null ? config.getSsi() : new Ssi();
        Nam nam = ssi.getNam() != null ? ssi.getNam() : new Nam();

        this.ssiName = firstNonBlank(env.apply(ENV_SSI_NAME), ssi.getName(), DEFAULT_SSI_NAME);
        this.priority = parsePriority(firstNonBlank(env.apply(ENV_PRIORITY), ssi.getPriority(), DEFAULT_PRIORITY));
        this.intervalSeconds = parseLong(ENV_INTERVAL, env.apply(ENV_INTERVAL), ssi.getIntervalSeconds(),
            DEFAULT_INTERVAL_SECONDS);
        this.cronMode = parseBoolean(env.apply(ENV_CRON_MODE), ssi.getCronMode());
        this.requestTimeoutMs = parseLong(ENV_REQUEST_TIMEOUT, env.apply(ENV_REQUEST_TIMEOUT),
            ssi.getRequestTimeoutMs(), DEFAULT_REQUEST_TIMEOUT_MS);
        this.workerThreads = (int) parseLong(ENV_WORKER_THREADS, env.apply(ENV_WORKER_THREADS),
            ssi.getWorkerThreads() != null ? ssi.getWorkerThreads().longValue() : null, DEFAULT_WORKER_THREADS);
        this.environment = firstNonBlank(env.apply(ENV_ENVIRONMENT), ssi.getEnvironment(), DEFAULT_ENVIRONMENT);
        this.namUrl = firstNonBlank(env.apply(ENV_NAM_URL), nam.getUrl(), null);
        this.namToken = firstNonBlank(env.apply(ENV_NAM_TOKEN), nam.getToken(), null);
        this.testIntegratorId = firstNonBlank(env.apply(ENV_NAM_TEST_INTEGRATOR), nam.getTestIntegrator(), null);
        this.hostname = firstNonBlank(env.apply(ENV_HOSTNAME), null, "localhost");

        log.info("Loaded sync config - name: {}, priority: {}, cron mode: {}, interval: {}s, request timeout: {}ms, environment: {}",
            ssiName, priority.getValue(), cronMode, intervalSeconds, requestTimeoutMs, environment);
    }

    public String getUserAgent() {
        return ssiName + "/" + APP_VERSION;
    }

    public boolean isDevMode() {
        return DEVELOPMENT_ENVIRONMENT.equalsIgnoreCase(environment);
    }

    /**
     * Diagnostic mode processes only the configured test integrator, even when disabled.
     */
    public boolean isDiagnosticMode() {
        return isDevMode() && testIntegratorId != null;
    }

    /**
     * Reads the YAML model from the external file when one is configured and readable,
     * otherwise from the classpath. Any failure yields an empty model so constants apply.
     */
    private ConfigModel loadYamlConfig(String externalConfigPath, String classpathResource) {
        Path external = externalConfigFile(externalConfigPath);
        if (external != null) {
            try (InputStream in = Files.newInputStream(external)) {
                return parseConfig(in, "external file (" + external + ")");
            } catch (IOException | SecurityException e) {
                log.warn("Error reading external config file {}: {}. Falling back.", external, e.getMessage());
            }
        }

        try (InputStream in = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (in == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
            return parseConfig(in, "classpath (" + classpathResource + ")");
        } catch (IOException e) {
            log.warn("Error reading config {} from classpath: {}. Using defaults.", classpathResource, e.getMessage());
            return new ConfigModel();
        }
    }

    private static Path externalConfigFile(String externalConfigPath) {
        if (EnvironmentUtils.isBlank(externalConfigPath)) {
            log.debug("{} not set, looking for config on classpath", ENV_CONFIG_FILE);
            return null;
        }
        Path path = Paths.get(externalConfigPath.trim());
        if (!Files.isRegularFile(path)) {
            log.warn("{} points at {}, which is not a readable file. Falling back.", ENV_CONFIG_FILE, path);
            return null;
        }
        return path;
    }

    private static ConfigModel parseConfig(InputStream in, String source) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        try {
            ConfigModel config = yaml.load(in);
            log.info("Loaded configuration from {}", source);
            return config != null ? config : new ConfigModel();
        } catch (YAMLException | ClassCastException e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", source, e.getMessage());
            return new ConfigModel();
        }
    }

    private static SyncPriority parsePriority(String value) {
        try {
            return SyncPriority.fromString(value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid sync priority '{}', using default '{}'", value, DEFAULT_PRIORITY);
            return SyncPriority.fromString(DEFAULT_PRIORITY);
        }
    }

    private static long parseLong(String name, String envValue, Long yamlValue, long defaultValue) {
        if (!EnvironmentUtils.isBlank(envValue)) {
            try {
                return Long.parseLong(envValue.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value '{}' for {}, ignoring", envValue, name);
            }
        }
        return yamlValue != null ? yamlValue : defaultValue;
    }

    private static boolean parseBoolean(String envValue, Boolean yamlValue) {
        if (!EnvironmentUtils.isBlank(envValue)) {
            return "true".equalsIgnoreCase(envValue.trim());
        }
        return yamlValue != null && yamlValue;
    }

    private static String firstNonBlank(String first, String second, String defaultValue) {
        if (!EnvironmentUtils.isBlank(first)) {
            return first.trim();
        }
        if (!EnvironmentUtils.isBlank(second)) {
            return second.trim();
        }
        return defaultValue;
    }

    /**
     * Configuration model for the application.yml file. Only the {@code ssi} section is read here;
     * the rest belongs to Spring.
     */
    @Data
    public static class ConfigModel {
        private Ssi ssi;
        private Object server;
        private Object spring;
        private Object management;
        private Object logging;
    }

    @Data
    public static class Ssi {
        private String name;
        private String priority;
        private Long intervalSeconds;
        private Boolean cronMode;
        private Long requestTimeoutMs;
        private Integer workerThreads;
        private String environment;
        private Nam nam;
    }

    @Data
    public static class Nam {
        private String url;
        private String token;
        private String testIntegrator;
    }
}
