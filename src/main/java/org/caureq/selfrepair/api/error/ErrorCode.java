package org.caureq.selfrepair.api.error;

public enum ErrorCode {
    BAD_REQUEST, COMPONENT_NOT_FOUND, SNAPSHOT_NOT_FOUND, INTEGRITY_FAILURE, AUTH_REQUIRED, INTERNAL_ERROR
}
