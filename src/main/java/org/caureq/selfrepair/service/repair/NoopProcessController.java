package org.caureq.selfrepair.service.repair;

import java.time.Duration;

/** Stand-in for components with no process behind them. */
public final class NoopProcessController implements ProcessController {
    public static final NoopProcessController INSTANCE = new NoopProcessController();

    private NoopProcessController() {}

    @Override public ControlResult start(Duration timeout) { return ControlResult.unsupported("start"); }
    @Override public ControlResult stop(Duration timeout) { return ControlResult.unsupported("stop"); }
    @Override public ControlResult restart(Duration timeout) { return ControlResult.unsupported("restart"); }
    @Override public ControlResult isHealthy(Duration timeout) { return ControlResult.unsupported("health"); }
    @Override public boolean managesProcess() { return false; }
}
