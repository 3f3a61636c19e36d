package io.controlplane.api.models.responses;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.controlplane.enums.ProvisioningState;
import io.controlplane.models.ResourceRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A provisioned resource as returned by a repeated POST /v1/provision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResourceResponse {
    private String id;
    private ProvisioningState state;
    private Instant lastUpdateAt;

    public static ResourceResponse from(ResourceRecord record) {
        return new ResourceResponse(record.getId(), record.getState(), record.getUpdatedAt());
    }
}
