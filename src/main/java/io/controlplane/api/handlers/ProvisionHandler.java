package io.controlplane.api.handlers;

import io.controlplane.api.models.requests.ProvisionRequest;
import io.controlplane.api.models.responses.ErrorResponse;
import io.controlplane.api.models.responses.ProvisionResponse;
import io.controlplane.api.models.responses.ResourceResponse;
import io.controlplane.config.ControlPlaneConfig;
import io.controlplane.provisioning.ProvisioningCancelledException;
import io.controlplane.provisioning.ProvisioningResult;
import io.controlplane.provisioning.ProvisioningService;
import io.controlplane.stats.StatsAggregator;
import io.controlplane.stats.StatsEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.time.Duration;

import static io.controlplane.config.Constants.API_PREFIX;

/**
 * REST API handler for resource provisioning.
 *
 * Supported operations:
 * - POST /v1/provision - Provision a resource by id
 *
 * Responses:
 * - 201 the work ran and completed within the deadline
 * - 200 the resource was already provisioned
 * - 202 provisioning of the resource is in progress elsewhere
 * - 504 the deadline passed; the shard reconciler finishes the work later
 *
 * Transport-level replays are answered by the idempotency filter before this handler runs.
 */
@Slf4j
@RestController
@RequestMapping(API_PREFIX)
public class ProvisionHandler {

    private final ProvisioningService provisioningService;
    private final StatsAggregator statsAggregator;
    private final Duration deadline;

    public ProvisionHandler(ProvisioningService provisioningService,
                            StatsAggregator statsAggregator,
                            ControlPlaneConfig config) {
        this.provisioningService = provisioningService;
        this.statsAggregator = statsAggregator;
        this.deadline = config.getProvisioningDeadline();
    }

    @PostMapping("/provision")
    public ResponseEntity<Object> provision(@Valid @RequestBody ProvisionRequest request) {
        String resourceId = request.getId();
        try {
            log.info("Provision request for resource '{}'", resourceId);
            ProvisioningResult result = provisioningService.provision(resourceId, deadline);
            switch (result.getOutcome()) {
                case CREATED:
                    return ResponseEntity.status(HttpStatus.CREATED).body(ProvisionResponse.created(resourceId));
                case ALREADY_PROVISIONED:
                    return ResponseEntity.ok(ResourceResponse.from(result.getRecord()));
                case IN_PROGRESS:
                default:
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(ProvisionResponse.inProgress(resourceId));
            }
        } catch (ProvisioningCancelledException e) {
            log.warn("Provisioning of resource '{}' cancelled: {}", resourceId, e.getMessage());
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ErrorResponse.gatewayTimeout("provisioning did not complete in time"));
        } catch (Exception e) {
            log.error("Error provisioning resource '{}': {}", resourceId, e.getMessage(), e);
            statsAggregator.record(StatsEvent.of(StatsEvent.Type.PROVISION_ERROR));
            return ResponseEntity.status(500).body(ErrorResponse.internalError("failed to provision resource"));
        }
    }
}
