package io.controlplane.metrics;

/**
 * Constants for metrics names and tags used in the control plane.
 */
public class MetricsConstants {
    public final static String PROVISION_REQUESTS_METRIC_NAME = "provision_requests_total";
    public final static String IDEMPOTENT_REPLAYS_METRIC_NAME = "idempotent_replays_total";
    public final static String RECONCILE_CYCLE_DURATION_METRIC_NAME = "reconcile_cycle_duration";
    public final static String RESOURCES_CREATED_METRIC_NAME = "reconcile_resources_created_total";
    public final static String RESOURCES_DELETED_METRIC_NAME = "reconcile_resources_deleted_total";
    public final static String RESOURCES_COMPLETED_METRIC_NAME = "reconcile_resources_completed_total";
    public final static String LEADER_METRIC_NAME = "control_plane_leader";
    public final static String DESIRED_METRIC_NAME = "control_plane_desired";
    public final static String OBSERVED_METRIC_NAME = "control_plane_observed";
    public final static String NODE_TAG = "node";
    public final static String OUTCOME_TAG = "outcome";
    public final static String SHARD_TAG = "shard";

    private MetricsConstants() {}
}
