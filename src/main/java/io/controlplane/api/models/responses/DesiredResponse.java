package io.controlplane.api.models.responses;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DesiredResponse {
    private String message;
    private long desired;

    public static DesiredResponse updated(long desired) {
        return new DesiredResponse("Desired state updated", desired);
    }
}
