package io.controlplane;

import io.controlplane.election.LeaseManager;
import io.controlplane.metrics.MetricsProvider;
import io.controlplane.reconcile.GlobalReconcileResult;
import io.controlplane.reconcile.GlobalReconciler;
import io.controlplane.reconcile.ShardReconcileResult;
import io.controlplane.reconcile.ShardReconciler;
import io.controlplane.sharding.ShardConfig;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.stats.StatsEvent;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the reconciliation tick of this node.
 * Each cycle: try to acquire the lease, run the global reconciler if leader, then run the
 * shard reconciler unconditionally. A failing step is logged and the cycle moves on; the next
 * tick starts from a fresh read of the store.
 */
@Slf4j
public class ReconciliationManager {

    private final String nodeId;
    private final LeaseManager leaseManager;
    private final GlobalReconciler globalReconciler;
    private final ShardReconciler shardReconciler;
    private final MetricsProvider metricsProvider;
    private final StatsAggregator statsAggregator;

    private final ScheduledExecutorService scheduler;
    private final long intervalSeconds;
    private volatile boolean isRunning = false;

    private final Timer cycleTimer;

    public ReconciliationManager(String nodeId,
                                 ShardConfig shardConfig,
                                 LeaseManager leaseManager,
                                 GlobalReconciler globalReconciler,
                                 ShardReconciler shardReconciler,
                                 MetricsProvider metricsProvider,
                                 StatsAggregator statsAggregator,
                                 long intervalSeconds) {
        this.nodeId = nodeId;
        this.leaseManager = leaseManager;
        this.globalReconciler = globalReconciler;
        this.shardReconciler = shardReconciler;
        this.metricsProvider = metricsProvider;
        this.statsAggregator = statsAggregator;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newScheduledThreadPool(1);

        this.cycleTimer = metricsProvider.reconcileCycleTimer(shardConfig);
    }

    public void start() {
        log.info("[Node: {}] Starting reconciliation loop every {}s", nodeId, intervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::runCycle,
                0,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        log.info("[Node: {}] Stopping reconciliation loop", nodeId);
        isRunning = false;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Node: {}] Reconciliation loop did not stop within 5s", nodeId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return isRunning;
    }

    /**
     * One reconciliation cycle. Never throws.
     */
    void runCycle() {
        Timer.Sample sample = Timer.start();
        try {
            boolean leader = leaseManager.tryAcquireLease(nodeId);
            metricsProvider.setLeader(leader);
            statsAggregator.record(StatsEvent.of(leader ? StatsEvent.Type.LEADER_TICK : StatsEvent.Type.FOLLOWER_TICK));

            if (leader) {
                runGlobalStep();
            } else {
                log.debug("[Node: {}] Follower this tick, skipping global reconciliation", nodeId);
            }

            runShardStep();
        } catch (Exception e) {
            log.error("[Node: {}] Error in reconciliation cycle: {}", nodeId, e.getMessage(), e);
        } finally {
            sample.stop(cycleTimer);
        }
    }

    private void runGlobalStep() {
        try {
            GlobalReconcileResult result = globalReconciler.reconcile(nodeId, leaseManager.getLeaseDeadline());
            if (result.getCreated() > 0) {
                metricsProvider.recordResourcesCreated(result.getCreated());
                statsAggregator.record(StatsEvent.Type.RESOURCES_CREATED, result.getCreated());
            }
            if (result.getDeleted() > 0) {
                metricsProvider.recordResourcesDeleted(result.getDeleted());
                statsAggregator.record(StatsEvent.Type.RESOURCES_DELETED, result.getDeleted());
            }
            if (!result.isStable()) {
                log.info("[Node: {}][Leader] Global pass: created={} deleted={}", nodeId, result.getCreated(), result.getDeleted());
            }
        } catch (Exception e) {
            log.error("[Node: {}][Leader] Global reconciliation failed: {}", nodeId, e.getMessage());
        }
    }

    private void runShardStep() {
        try {
            ShardReconcileResult result = shardReconciler.reconcile(nodeId);
            if (result.getCompleted() > 0) {
                metricsProvider.recordResourcesCompleted(result.getCompleted());
                statsAggregator.record(StatsEvent.Type.RESOURCES_COMPLETED, result.getCompleted());
            }
        } catch (Exception e) {
            log.error("[Node: {}] Shard reconciliation failed: {}", nodeId, e.getMessage());
        }
    }
}
