package io.controlplane.provisioning;

import io.controlplane.models.ResourceRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ProvisioningResult {
    private final ProvisioningOutcome outcome;
    private final ResourceRecord record;
}
