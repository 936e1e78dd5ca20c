package org.caureq.selfrepair.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.service.integrity.IntegrityException;
import org.caureq.selfrepair.service.integrity.SnapshotNotFoundException;
import org.caureq.selfrepair.service.store.UnknownComponentException;
import org.springframework.http.*;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                ApiError.of(ErrorCode.BAD_REQUEST, "Validation error", req,
                        Map.of("fieldErrors", ex.getBindingResult().getAllErrors()))
        );
    }

    @ExceptionHandler(UnknownComponentException.class)
    public ResponseEntity<ApiError> handleUnknown(UnknownComponentException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                ApiError.of(ErrorCode.COMPONENT_NOT_FOUND, ex.getMessage(), req, Map.of())
        );
    }

    @ExceptionHandler(SnapshotNotFoundException.class)
    public ResponseEntity<ApiError> handleNoSnapshot(SnapshotNotFoundException ex, HttpServletRequest req) {
        var details = new LinkedHashMap<String, Object>();
        if (ex.snapshotId() != null) details.put("snapshotId", ex.snapshotId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                ApiError.of(ErrorCode.SNAPSHOT_NOT_FOUND, ex.getMessage(), req, details)
        );
    }

    @ExceptionHandler(IntegrityException.class)
    public ResponseEntity<ApiError> handleIntegrity(IntegrityException ex, HttpServletRequest req) {
        log.warn("[Integrity] request {} failed: {}", req.getRequestURI(), ex.getMessage());
        var details = new LinkedHashMap<String, Object>();
        if (ex.snapshotId() != null) details.put("snapshotId", ex.snapshotId());
        if (!ex.paths().isEmpty()) details.put("paths", ex.paths());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                ApiError.of(ErrorCode.INTEGRITY_FAILURE, ex.getMessage(), req, details)
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                ApiError.of(ErrorCode.BAD_REQUEST, ex.getMessage(), req, Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("[Api] {} {} failed", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                ApiError.of(ErrorCode.INTERNAL_ERROR, ex.getMessage(), req, Map.of())
        );
    }
}
