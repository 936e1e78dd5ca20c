package org.caureq.selfrepair.service.health;

public record ProbeResult(boolean healthy, String detail) {
    public static ProbeResult healthy(String detail) { return new ProbeResult(true, detail); }
    public static ProbeResult unhealthy(String detail) { return new ProbeResult(false, detail); }
}
