package org.caureq.selfrepair.service.repair;

public record RepairContext(long attemptId, String incidentId, String errorMessage, String errorType, int failureCount) {}
