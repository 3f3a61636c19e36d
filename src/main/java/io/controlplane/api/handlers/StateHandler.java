package io.controlplane.api.handlers;

import io.controlplane.api.models.requests.DesiredRequest;
import io.controlplane.api.models.responses.DesiredResponse;
import io.controlplane.api.models.responses.ErrorResponse;
import io.controlplane.api.models.responses.StateResponse;
import io.controlplane.config.ControlPlaneConfig;
import io.controlplane.election.LeaseManager;
import io.controlplane.models.ClusterState;
import io.controlplane.models.LeaseRecord;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.stats.StatsSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.concurrent.TimeUnit;

import static io.controlplane.config.Constants.API_PREFIX;
import static io.controlplane.config.Constants.STATUS_RECONCILING;
import static io.controlplane.config.Constants.STATUS_STABLE;

/**
 * REST API handler for the cluster-level counters of this node.
 *
 * Supported operations:
 * - GET /v1/state - desired and observed counts and whether they converged
 * - POST /v1/desired - set the target resource count
 * - GET /v1/stats - aggregated provisioning and reconciliation tallies
 */
@Slf4j
@RestController
@RequestMapping(API_PREFIX)
public class StateHandler {

    private static final long STATS_TIMEOUT_MILLIS = 2000;

    private final ClusterState clusterState;
    private final LeaseManager leaseManager;
    private final StatsAggregator statsAggregator;
    private final String nodeId;

    public StateHandler(ClusterState clusterState,
                        LeaseManager leaseManager,
                        StatsAggregator statsAggregator,
                        ControlPlaneConfig config) {
        this.clusterState = clusterState;
        this.leaseManager = leaseManager;
        this.statsAggregator = statsAggregator;
        this.nodeId = config.getNodeId();
    }

    /**
     * GET /v1/state
     */
    @GetMapping("/state")
    public ResponseEntity<Object> getState() {
        ClusterState.Snapshot snapshot = clusterState.snapshot();
        StateResponse response = StateResponse.builder()
            .desired(snapshot.getDesired())
            .observed(snapshot.getObserved())
            .status(snapshot.isStable() ? STATUS_STABLE : STATUS_RECONCILING)
            .nodeId(nodeId)
            .leader(leaseManager.isLeader())
            .leaseHolder(leaseManager.currentHolder().map(LeaseRecord::getNodeId).orElse(null))
            .build();
        return ResponseEntity.ok(response);
    }

    /**
     * POST /v1/desired
     */
    @PostMapping("/desired")
    public ResponseEntity<Object> setDesired(@Valid @RequestBody DesiredRequest request) {
        long desired = request.getCount();
        clusterState.setDesired(desired);
        log.info("[Node: {}] Desired count set to {}", nodeId, desired);
        return ResponseEntity.ok(DesiredResponse.updated(desired));
    }

    /**
     * GET /v1/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Object> getStats() {
        try {
            StatsSnapshot snapshot = statsAggregator.snapshot().get(STATS_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
            return ResponseEntity.ok(snapshot);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(500).body(ErrorResponse.internalError("stats unavailable"));
        } catch (Exception e) {
            log.error("[Node: {}] Error reading stats: {}", nodeId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError("stats unavailable"));
        }
    }
}
