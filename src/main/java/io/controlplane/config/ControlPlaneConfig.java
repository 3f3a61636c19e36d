package io.controlplane.config;

import io.controlplane.sharding.ShardConfig;
import io.controlplane.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static io.controlplane.config.Constants.*;

/**
 * Configuration for a control plane node.
 * Loads configuration from control-plane.yml with fallbacks to constants; node identity,
 * shard placement and the auth token may be overridden through environment variables.
 * <p>
 * Spring-level settings (port, datasource, actuator) stay in application.yml.
 */
@Slf4j
@Getter
public class ControlPlaneConfig {

    private final String nodeId;
    private final ShardConfig shardConfig;
    private final Duration leaseDuration;
    private final Duration reconcileInterval;
    private final boolean reconcilerEnabled;
    private final Duration provisioningMaxDelay;
    private final Duration provisioningDeadline;
    private final String authToken;
    private final List<String> idempotencyExemptPaths;
    private final int maxConcurrentRequests;
    private final double requestsPerSecond;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "control-plane.yml";

    public ControlPlaneConfig() {
        this(System::getenv);
    }

    public ControlPlaneConfig(Function<String, String> env) {
        this(loadYamlConfig(env), env);
    }

    public ControlPlaneConfig(ConfigModel config, Function<String, String> env) {
        this.nodeId = parseNodeId(config, env);
        this.shardConfig = parseShardConfig(config, env);
        this.leaseDuration = Duration.ofSeconds(positiveOrDefault(
            config.getLease() != null ? config.getLease().getDurationSeconds() : null,
            DEFAULT_LEASE_DURATION_SECONDS));
        this.reconcileInterval = Duration.ofSeconds(positiveOrDefault(
            config.getReconciler() != null ? config.getReconciler().getIntervalSeconds() : null,
            DEFAULT_RECONCILE_INTERVAL_SECONDS));
        this.reconcilerEnabled = config.getReconciler() == null
            || config.getReconciler().getEnabled() == null
            || config.getReconciler().getEnabled();
        this.provisioningMaxDelay = Duration.ofMillis(nonNegativeOrDefault(
            config.getProvisioning() != null ? config.getProvisioning().getMaxDelayMillis() : null,
            DEFAULT_PROVISIONING_MAX_DELAY_MILLIS));
        this.provisioningDeadline = Duration.ofMillis(positiveOrDefault(
            config.getProvisioning() != null ? config.getProvisioning().getDeadlineMillis() : null,
            DEFAULT_PROVISIONING_DEADLINE_MILLIS));
        this.authToken = EnvironmentUtils.getEnv(env, ENV_AUTH_TOKEN,
            config.getAuth() != null && config.getAuth().getToken() != null && !config.getAuth().getToken().isBlank()
                ? config.getAuth().getToken()
                : DEFAULT_AUTH_TOKEN);
        this.idempotencyExemptPaths = config.getIdempotency() != null && config.getIdempotency().getExemptPaths() != null
            ? List.copyOf(config.getIdempotency().getExemptPaths())
            : List.of(PATH_DESIRED);
        this.maxConcurrentRequests = config.getAdmission() != null && config.getAdmission().getMaxConcurrent() != null
            ? Math.max(0, config.getAdmission().getMaxConcurrent())
            : 0;
        this.requestsPerSecond = config.getAdmission() != null && config.getAdmission().getRequestsPerSecond() != null
            ? Math.max(0d, config.getAdmission().getRequestsPerSecond())
            : 0d;

        if (leaseDuration.compareTo(reconcileInterval) <= 0) {
            log.warn("Lease duration {}s is not longer than the reconcile interval {}s; leadership will flap",
                leaseDuration.getSeconds(), reconcileInterval.getSeconds());
        }

        log.info("Loaded control plane config - node: {}, shard: {}/{}, lease: {}s, tick: {}s",
            nodeId, shardConfig.getNodeIndex(), shardConfig.getTotalNodes(),
            leaseDuration.getSeconds(), reconcileInterval.getSeconds());
    }

    /**
     * Reads the model from the file named by {@code CONTROL_PLANE_CONFIG_FILE} when it exists,
     * else from the classpath. A missing or unparsable source yields an empty model, so every
     * setting falls back to its default.
     */
    private static ConfigModel loadYamlConfig(Function<String, String> env) {
        Optional<Path> external = Optional.ofNullable(env.apply(ENV_CONFIG_FILE))
            .map(String::trim)
            .filter(path -> !path.isEmpty())
            .map(Paths::get);

        if (external.isPresent()) {
            Path path = external.get();
            if (Files.isReadable(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    return parse(in, path.toString());
                } catch (IOException e) {
                    log.warn("Could not read {} from {}: {}; trying classpath", DEFAULT_CONFIG_FILE_CLASSPATH, path, e.getMessage());
                }
            } else {
                log.warn("{}={} is not a readable file; trying classpath", ENV_CONFIG_FILE, path);
            }
        }

        try (InputStream in = ControlPlaneConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH)) {
            if (in == null) {
                log.warn("No {} on classpath, using defaults", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
            return parse(in, "classpath:" + DEFAULT_CONFIG_FILE_CLASSPATH);
        } catch (IOException e) {
            log.warn("Could not read classpath {}: {}; using defaults", DEFAULT_CONFIG_FILE_CLASSPATH, e.getMessage());
            return new ConfigModel();
        }
    }

    private static ConfigModel parse(InputStream in, String source) {
        try {
            ConfigModel model = new Yaml(new Constructor(ConfigModel.class)).load(in);
            log.info("Control plane config read from {}", source);
            return model != null ? model : new ConfigModel();
        } catch (YAMLException e) {
            log.warn("Malformed config in {}: {}; using defaults", source, e.getMessage());
            return new ConfigModel();
        }
    }

    private static String parseNodeId(ConfigModel config, Function<String, String> env) {
        String fromFile = config.getNode() != null && config.getNode().getId() != null && !config.getNode().getId().isBlank()
            ? config.getNode().getId()
            : DEFAULT_NODE_ID;
        return EnvironmentUtils.getEnv(env, ENV_NODE_ID, fromFile);
    }

    private static ShardConfig parseShardConfig(ConfigModel config, Function<String, String> env) {
        Integer fileIndex = config.getShard() != null ? config.getShard().getIndex() : null;
        Integer fileTotal = config.getShard() != null ? config.getShard().getTotal() : null;

        int index = EnvironmentUtils.getIntEnv(env, ENV_NODE_INDEX, fileIndex != null ? fileIndex : DEFAULT_NODE_INDEX);
        int total = EnvironmentUtils.getIntEnv(env, ENV_TOTAL_NODES, fileTotal != null ? fileTotal : DEFAULT_TOTAL_NODES);

        if (index < 0) {
            log.warn("Invalid node index {}, defaulting to {}", index, DEFAULT_NODE_INDEX);
            index = DEFAULT_NODE_INDEX;
        }
        if (total <= 0) {
            log.warn("Invalid total node count {}, defaulting to single-node mode", total);
            total = DEFAULT_TOTAL_NODES;
        }
        return new ShardConfig(index, total);
    }

    private static long positiveOrDefault(Long value, long defaultValue) {
        return value != null && value > 0 ? value : defaultValue;
    }

    private static long nonNegativeOrDefault(Long value, long defaultValue) {
        return value != null && value >= 0 ? value : defaultValue;
    }

    /**
     * Configuration model for the control-plane.yml file.
     */
    @Data
    public static class ConfigModel {
        private Node node;
        private Shard shard;
        private Lease lease;
        private Reconciler reconciler;
        private Provisioning provisioning;
        private Auth auth;
        private Idempotency idempotency;
        private Admission admission;
    }

    @Data
    public static class Node {
        private String id;
    }

    @Data
    public static class Shard {
        private Integer index;
        private Integer total;
    }

    @Data
    public static class Lease {
        private Long durationSeconds;
    }

    @Data
    public static class Reconciler {
        private Boolean enabled;
        private Long intervalSeconds;
    }

    @Data
    public static class Provisioning {
        private Long maxDelayMillis;
        private Long deadlineMillis;
    }

    @Data
    public static class Auth {
        private String token;
    }

    @Data
    public static class Idempotency {
        private List<String> exemptPaths;
    }

    @Data
    public static class Admission {
        private Integer maxConcurrent;
        private Double requestsPerSecond;
    }
}
