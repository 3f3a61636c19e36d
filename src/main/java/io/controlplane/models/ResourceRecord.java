package io.controlplane.models;

import io.controlplane.enums.ProvisioningState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A row of the resource ledger: the provisioning lifecycle of one business entity,
 * keyed by its caller-supplied id and independent of any idempotency key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceRecord {
    private String id;
    private ProvisioningState state;
    private Instant createdAt;
    private Instant updatedAt;
}
