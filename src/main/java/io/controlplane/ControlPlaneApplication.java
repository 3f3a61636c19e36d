package io.controlplane;

import io.controlplane.config.ControlPlaneConfig;
import io.controlplane.election.LeaseManager;
import io.controlplane.enums.ProvisioningState;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.models.ClusterState;
import io.controlplane.provisioning.ProvisioningService;
import io.controlplane.provisioning.SimulatedProvisioner;
import io.controlplane.reconcile.GlobalReconciler;
import io.controlplane.reconcile.ShardReconciler;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.store.JdbcLedgerStore;
import io.controlplane.store.LedgerStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Main Spring Boot application class for a control plane node.
 *
 * Every node serves the provisioning API, polls the shared ledger store on a fixed tick,
 * competes for the reconciler lease and completes the provisioning work of its own shard.
 * Node identity and shard placement come from configuration.
 */
@Slf4j
@SpringBootApplication
public class ControlPlaneApplication {

    public static void main(String[] args) {
        log.info("Starting Control Plane Application");

        try {
            SpringApplication.run(ControlPlaneApplication.class, args);
            log.info("Control Plane started successfully");

        } catch (Exception e) {
            log.error("Failed to start Control Plane: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public ControlPlaneConfig config() {
        ControlPlaneConfig config = new ControlPlaneConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * LedgerStore bean over the configured datasource; creates the schema if absent.
     */
    @Bean
    public LedgerStore ledgerStore(JdbcTemplate jdbcTemplate, Clock clock) {
        log.info("Initializing JDBC LedgerStore");
        try {
            JdbcLedgerStore store = new JdbcLedgerStore(jdbcTemplate, clock);
            store.initialize();
            log.info("LedgerStore initialized successfully");
            return store;
        } catch (Exception e) {
            log.error("Failed to initialize LedgerStore: {}", e.getMessage(), e);
            throw new IllegalStateException("LedgerStore initialization failed", e);
        }
    }

    /**
     * In-memory counters, seeded from the ledger so a restarted node does not scale the
     * fleet down to zero before anyone sets a target.
     */
    @Bean
    public ClusterState clusterState(LedgerStore ledgerStore) {
        long total = ledgerStore.countResources();
        long provisioned = ledgerStore.countResourcesByState(ProvisioningState.PROVISIONED);
        log.info("Seeding cluster state from ledger: desired={} observed={}", total, provisioned);
        return new ClusterState(total, provisioned);
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, ControlPlaneConfig config, ClusterState clusterState) {
        return new MetricsProvider(meterRegistry, config.getNodeId(), clusterState);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public StatsAggregator statsAggregator(ControlPlaneConfig config, Clock clock) {
        return new StatsAggregator(config.getNodeId(), clock);
    }

    @Bean
    public LeaseManager leaseManager(LedgerStore ledgerStore, ControlPlaneConfig config, Clock clock) {
        log.info("Initializing LeaseManager with lease duration {}s", config.getLeaseDuration().getSeconds());
        return new LeaseManager(ledgerStore, config.getLeaseDuration(), clock);
    }

    @Bean
    public GlobalReconciler globalReconciler(LedgerStore ledgerStore, ClusterState clusterState, Clock clock) {
        return new GlobalReconciler(ledgerStore, clusterState, clock);
    }

    @Bean
    public ShardReconciler shardReconciler(LedgerStore ledgerStore, ControlPlaneConfig config, ClusterState clusterState) {
        log.info("Initializing ShardReconciler for shard {}", config.getShardConfig());
        return new ShardReconciler(ledgerStore, config.getShardConfig(), clusterState);
    }

    @Bean(destroyMethod = "shutdown")
    public SimulatedProvisioner simulatedProvisioner(ControlPlaneConfig config) {
        return new SimulatedProvisioner(config.getProvisioningMaxDelay());
    }

    @Bean
    public ProvisioningService provisioningService(LedgerStore ledgerStore,
                                                   SimulatedProvisioner simulatedProvisioner,
                                                   ClusterState clusterState,
                                                   MetricsProvider metricsProvider,
                                                   StatsAggregator statsAggregator) {
        return new ProvisioningService(ledgerStore, simulatedProvisioner, clusterState, metricsProvider, statsAggregator);
    }

    @Bean(destroyMethod = "stop")
    public ReconciliationManager reconciliationManager(ControlPlaneConfig config,
                                                       LeaseManager leaseManager,
                                                       GlobalReconciler globalReconciler,
                                                       ShardReconciler shardReconciler,
                                                       MetricsProvider metricsProvider,
                                                       StatsAggregator statsAggregator) {
        ReconciliationManager manager = new ReconciliationManager(
            config.getNodeId(),
            config.getShardConfig(),
            leaseManager,
            globalReconciler,
            shardReconciler,
            metricsProvider,
            statsAggregator,
            config.getReconcileInterval().getSeconds()
        );
        if (config.isReconcilerEnabled()) {
            manager.start();
            log.info("ReconciliationManager started for node: {}", config.getNodeId());
        } else {
            log.info("Reconciliation loop disabled by configuration");
        }
        return manager;
    }
}
