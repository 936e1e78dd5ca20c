package org.caureq.selfrepair.service.repair;

public record ControlResult(boolean ok, boolean supported, String detail) {
    public static ControlResult ok(String detail) { return new ControlResult(true, true, detail); }
    public static ControlResult failed(String detail) { return new ControlResult(false, true, detail); }
    public static ControlResult unsupported(String operation) {
        return new ControlResult(false, false, operation + " not configured");
    }
}
