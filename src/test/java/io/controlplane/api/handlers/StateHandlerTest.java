package io.controlplane.api.handlers;

import io.controlplane.api.models.requests.DesiredRequest;
import io.controlplane.api.models.responses.DesiredResponse;
import io.controlplane.api.models.responses.StateResponse;
import io.controlplane.config.ControlPlaneConfig;
import io.controlplane.election.LeaseManager;
import io.controlplane.models.ClusterState;
import io.controlplane.models.LeaseRecord;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.stats.StatsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class StateHandlerTest {

    @Mock
    private LeaseManager leaseManager;

    @Mock
    private StatsAggregator statsAggregator;

    @Mock
    private ControlPlaneConfig config;

    private ClusterState clusterState;
    private StateHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(config.getNodeId()).thenReturn("n1");
        clusterState = new ClusterState(3, 1);
        handler = new StateHandler(clusterState, leaseManager, statsAggregator, config);
    }

    @Test
    void testGetState_Reconciling() {
        // Given
        when(leaseManager.isLeader()).thenReturn(true);
        when(leaseManager.currentHolder()).thenReturn(Optional.of(
            LeaseRecord.builder().id("reconciler-lock").nodeId("n1").expiresAt(Instant.now()).build()));

        // When
        ResponseEntity<Object> response = handler.getState();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        StateResponse body = (StateResponse) response.getBody();
        assertThat(body.getDesired()).isEqualTo(3);
        assertThat(body.getObserved()).isEqualTo(1);
        assertThat(body.getStatus()).isEqualTo("reconciling");
        assertThat(body.getNodeId()).isEqualTo("n1");
        assertThat(body.getLeader()).isTrue();
        assertThat(body.getLeaseHolder()).isEqualTo("n1");
    }

    @Test
    void testGetState_Stable() {
        when(leaseManager.currentHolder()).thenReturn(Optional.empty());
        clusterState.setObserved(3);

        StateResponse body = (StateResponse) handler.getState().getBody();

        assertThat(body.getStatus()).isEqualTo("stable");
        assertThat(body.getLeaseHolder()).isNull();
    }

    @Test
    void testSetDesired() {
        // When
        ResponseEntity<Object> response = handler.setDesired(new DesiredRequest(7L));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((DesiredResponse) response.getBody()).getDesired()).isEqualTo(7);
        assertThat(clusterState.getDesired()).isEqualTo(7);
    }

    @Test
    void testGetStats() {
        // Given
        StatsSnapshot snapshot = new StatsSnapshot("n1", Instant.now(), Map.of("provision_created", 2L));
        when(statsAggregator.snapshot()).thenReturn(CompletableFuture.completedFuture(snapshot));

        // When
        ResponseEntity<Object> response = handler.getStats();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(snapshot);
    }

    @Test
    void testGetStats_AggregatorUnavailable() {
        CompletableFuture<StatsSnapshot> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("Stats aggregator is not running"));
        when(statsAggregator.snapshot()).thenReturn(failed);

        ResponseEntity<Object> response = handler.getStats();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
