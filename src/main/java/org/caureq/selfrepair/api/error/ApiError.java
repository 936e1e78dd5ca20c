package org.caureq.selfrepair.api.error;

import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;
import java.util.Map;

/** Error body returned by every supervisor endpoint. */
public record ApiError(
        Instant timestamp,
        ErrorCode code,
        String message,
        String path,
        String correlationId,
        Map<String,Object> details
) {
    public static ApiError of(ErrorCode code, String message, HttpServletRequest req, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, message, req.getRequestURI(),
                req.getHeader("X-Correlation-Id"), details);
    }
}
