package io.controlplane.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cached response of the first successful request carrying a given idempotency key.
 * Written once, never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {
    private String key;
    private int statusCode;
    private byte[] responseBody;
    private String contentType;
    private Instant createdAt;
}
