package io.controlplane.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The singleton leader lease row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaseRecord {
    private String id;
    private String nodeId;
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || expiresAt.isBefore(now);
    }
}
