package io.controlplane.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.controlplane.models.ClusterState;
import io.controlplane.provisioning.ProvisioningOutcome;
import io.controlplane.sharding.ShardConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

import static io.controlplane.metrics.MetricsConstants.*;

/**
 * Meters of one control plane node. Every meter carries a {@code node} tag.
 * <p>
 * Counters are registered up front so they read zero before the first event; the desired and
 * observed gauges read {@link ClusterState} directly on every scrape.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String CANCELLED_OUTCOME = "cancelled";

    private final MeterRegistry registry;
    private final Tags nodeTags;

    private final Map<ProvisioningOutcome, Counter> provisionOutcomes = new EnumMap<>(ProvisioningOutcome.class);
    private final Counter provisionCancelled;
    private final Counter idempotentReplays;
    private final Counter resourcesCreated;
    private final Counter resourcesDeleted;
    private final Counter resourcesCompleted;
    private final AtomicDouble leader = new AtomicDouble(0);

    public MetricsProvider(MeterRegistry registry, String nodeId, ClusterState clusterState) {
        this.registry = registry;
        this.nodeTags = Tags.of(NODE_TAG, nodeId);

        for (ProvisioningOutcome outcome : ProvisioningOutcome.values()) {
            provisionOutcomes.put(outcome, provisionCounter(outcome.name().toLowerCase()));
        }
        this.provisionCancelled = provisionCounter(CANCELLED_OUTCOME);
        this.idempotentReplays = counter(IDEMPOTENT_REPLAYS_METRIC_NAME);
        this.resourcesCreated = counter(RESOURCES_CREATED_METRIC_NAME);
        this.resourcesDeleted = counter(RESOURCES_DELETED_METRIC_NAME);
        this.resourcesCompleted = counter(RESOURCES_COMPLETED_METRIC_NAME);

        Gauge.builder(LEADER_METRIC_NAME, leader, AtomicDouble::get).tags(nodeTags).register(registry);
        Gauge.builder(DESIRED_METRIC_NAME, clusterState, state -> state.getDesired())
            .tags(nodeTags).strongReference(true).register(registry);
        Gauge.builder(OBSERVED_METRIC_NAME, clusterState, state -> state.getObserved())
            .tags(nodeTags).strongReference(true).register(registry);

        log.info("MetricsProvider initialized for node: {}", nodeId);
    }

    public void recordProvisionOutcome(ProvisioningOutcome outcome) {
        provisionOutcomes.get(outcome).increment();
    }

    public void recordProvisionCancelled() {
        provisionCancelled.increment();
    }

    public void recordIdempotentReplay() {
        idempotentReplays.increment();
    }

    public void recordResourcesCreated(int count) {
        resourcesCreated.increment(count);
    }

    public void recordResourcesDeleted(int count) {
        resourcesDeleted.increment(count);
    }

    public void recordResourcesCompleted(int count) {
        resourcesCompleted.increment(count);
    }

    public void setLeader(boolean isLeader) {
        leader.set(isLeader ? 1 : 0);
    }

    /**
     * Timer for whole reconciliation cycles, tagged with the shard as {@code index/total}.
     */
    public Timer reconcileCycleTimer(ShardConfig shardConfig) {
        return Timer.builder(RECONCILE_CYCLE_DURATION_METRIC_NAME)
            .tags(nodeTags)
            .tag(SHARD_TAG, shardConfig.getNodeIndex() + "/" + shardConfig.getTotalNodes())
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private Counter provisionCounter(String outcome) {
        return Counter.builder(PROVISION_REQUESTS_METRIC_NAME)
            .tags(nodeTags)
            .tag(OUTCOME_TAG, outcome)
            .register(registry);
    }

    private Counter counter(String name) {
        return Counter.builder(name).tags(nodeTags).register(registry);
    }
}
