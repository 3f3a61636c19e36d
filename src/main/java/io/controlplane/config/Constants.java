package io.controlplane.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_NODE_ID = "local";
    public static final int DEFAULT_NODE_INDEX = 0;
    public static final int DEFAULT_TOTAL_NODES = 1;
    public static final long DEFAULT_LEASE_DURATION_SECONDS = 15L;
    public static final long DEFAULT_RECONCILE_INTERVAL_SECONDS = 5L;
    public static final long DEFAULT_PROVISIONING_MAX_DELAY_MILLIS = 4000L;
    public static final long DEFAULT_PROVISIONING_DEADLINE_MILLIS = 10000L;
    public static final String DEFAULT_AUTH_TOKEN = "secret";

    // Environment variables
    public static final String ENV_NODE_ID = "NODE_ID";
    public static final String ENV_NODE_INDEX = "NODE_INDEX";
    public static final String ENV_TOTAL_NODES = "TOTAL_NODES";
    public static final String ENV_AUTH_TOKEN = "AUTH_TOKEN";
    public static final String ENV_CONFIG_FILE = "CONTROL_PLANE_CONFIG_FILE";

    // Lease
    public static final String LEASE_ID = "reconciler-lock";

    // HTTP headers
    public static final String HEADER_AUTH_TOKEN = "X-Auth-Token";
    public static final String HEADER_IDEMPOTENCY_KEY = "X-Idempotency-Key";
    // Width of idempotency_records.idempotency_key
    public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    // API paths
    public static final String API_PREFIX = "/v1";
    public static final String PATH_DESIRED = API_PREFIX + "/desired";

    // Cluster status values reported by GET /v1/state
    public static final String STATUS_STABLE = "stable";
    public static final String STATUS_RECONCILING = "reconciling";

    // Generated resource id prefix used by scale-up
    public static final String GENERATED_RESOURCE_PREFIX = "global-auto-";
}
