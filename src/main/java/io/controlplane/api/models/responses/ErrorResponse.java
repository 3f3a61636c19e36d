package io.controlplane.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standard error response model for all API operations.
 * Reasons are generic; store and driver messages are logged, never returned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    private String error;
    private String reason;
    private Integer status;

    public static ErrorResponse badRequest(String message) {
        return ErrorResponse.builder()
            .error("bad_request")
            .reason(message)
            .status(400)
            .build();
    }

    public static ErrorResponse unauthorized() {
        return ErrorResponse.builder()
            .error("unauthorized")
            .reason("missing or invalid auth token")
            .status(401)
            .build();
    }

    public static ErrorResponse tooManyRequests(String message) {
        return ErrorResponse.builder()
            .error("too_many_requests")
            .reason(message)
            .status(429)
            .build();
    }

    public static ErrorResponse internalError(String message) {
        return ErrorResponse.builder()
            .error("internal_server_error")
            .reason(message)
            .status(500)
            .build();
    }

    public static ErrorResponse gatewayTimeout(String message) {
        return ErrorResponse.builder()
            .error("gateway_timeout")
            .reason(message)
            .status(504)
            .build();
    }
}
