package io.controlplane.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.controlplane.enums.ProvisioningState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of 201 and 202 answers to POST /v1/provision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProvisionResponse {
    private String message;
    private String id;
    private ProvisioningState state;

    public static ProvisionResponse created(String id) {
        return new ProvisionResponse("successfully provisioned", id, ProvisioningState.PROVISIONED);
    }

    public static ProvisionResponse inProgress(String id) {
        return new ProvisionResponse("Resource provisioning already in progress", id, null);
    }
}
