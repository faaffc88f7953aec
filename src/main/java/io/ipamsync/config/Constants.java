package io.ipamsync.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    public static final String APP_VERSION = "1.0.0";

    // Default configuration values
    public static final String DEFAULT_SSI_NAME = "SSI_NAME_MISSING";
    public static final String DEFAULT_PRIORITY = "low";
    public static final long DEFAULT_INTERVAL_SECONDS = 900L;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 10000L;
    public static final int DEFAULT_WORKER_THREADS = 8;
    public static final String DEFAULT_ENVIRONMENT = "production";
    public static final String DEVELOPMENT_ENVIRONMENT = "development";

    // Environment variables
    public static final String ENV_CONFIG_FILE = "SSI_CONFIG_FILE";
    public static final String ENV_SSI_NAME = "SSI_NAME";
    public static final String ENV_PRIORITY = "SSI_PRIORITY";
    public static final String ENV_INTERVAL = "SSI_INTERVAL";
    public static final String ENV_CRON_MODE = "CRON_MODE";
    public static final String ENV_REQUEST_TIMEOUT = "REQUEST_TIMEOUT";
    public static final String ENV_WORKER_THREADS = "SSI_WORKER_THREADS";
    public static final String ENV_ENVIRONMENT = "SSI_ENV";
    public static final String ENV_NAM_URL = "NAM_URL";
    public static final String ENV_NAM_TOKEN = "NAM_TOKEN";
    public static final String ENV_NAM_TEST_INTEGRATOR = "NAM_TEST_INT";
    public static final String ENV_HOSTNAME = "HOSTNAME";

    // Managed object attributes
    public static final String MANAGED_COMMENT = "Managed by NAM";
    public static final int ADDRESS_COLOR = 0;
    public static final int ADDRESS_GROUP_COLOR = 3;
    public static final String SECURITY_GROUP_PREFIX = "nsg-";
    public static final String IP_ADDRESS_EXPRESSION = "IPAddressExpression";
    public static final String NSX_GLOBAL_MANAGER_TYPE = "global";

    // API paths
    public static final String NAM_INTEGRATORS_PATH = "/netbox_integrators";
    public static final String NETBOX_PREFIXES_PATH = "/api/ipam/prefixes/";
    public static final String FORTIOS_CMDB_PATH = "/api/v2/cmdb/";
    public static final String NSX_LOCAL_GROUPS_PATH = "/policy/api/v1/infra/domains/default/groups/";
    public static final String NSX_GLOBAL_GROUPS_PATH = "/global-manager/api/v1/global-infra/domains/default/groups/";

    // Process exit codes
    public static final int EXIT_CODE_SUCCESS = 0;
    public static final int EXIT_CODE_FAILURE = 1;
    public static final int EXIT_CODE_ALREADY_RUNNING = 7;
}
