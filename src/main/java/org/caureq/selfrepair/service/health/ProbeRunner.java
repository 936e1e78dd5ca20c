package org.caureq.selfrepair.service.health;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Runs a single probe with a hard timeout. A probe that overruns is interrupted and abandoned;
 * it is reported as a failure, never ignored.
 * <p>
 * Probe threads are capped at twice {@code max-concurrent-probes}: one share for the health cycle,
 * one for validation probes after repairs. Probes that ignore interruption keep their thread, and
 * once the cap is reached further probes fail at once instead of adding threads.
 */
@Slf4j
@Component
public class ProbeRunner {
    private final ThreadPoolExecutor probes;

    public ProbeRunner(SupervisorProps props) {
        int max = 2 * Math.max(1, props.health().maxConcurrentProbes());
        var factory = new CustomizableThreadFactory("probe-");
        factory.setDaemon(true);
        this.probes = new ThreadPoolExecutor(0, max, 60, TimeUnit.SECONDS, new SynchronousQueue<>(), factory);
    }

    public ProbeOutcome run(MonitoredComponent component, Duration timeout) {
        long start = System.nanoTime();
        Future<ProbeResult> f;
        try {
            f = probes.submit(() -> component.probe().check(timeout));
        } catch (RejectedExecutionException e) {
            if (probes.isShutdown()) {
                return new ProbeOutcome(component.name(), false, "probe rejected: supervisor shutting down", "cancelled", Duration.ZERO);
            }
            log.warn("[Health] {} not probed: all {} probe threads busy with overrunning probes",
                    component.name(), probes.getMaximumPoolSize());
            return new ProbeOutcome(component.name(), false,
                    "probe rejected: %d earlier probes still running".formatted(probes.getActiveCount()), "saturated", Duration.ZERO);
        }
        try {
            var r = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (r == null) return failure(component, "probe returned no result", "unhealthy", start);
            return r.healthy()
                    ? new ProbeOutcome(component.name(), true, r.detail(), null, since(start))
                    : failure(component, r.detail(), "unhealthy", start);
        } catch (TimeoutException e) {
            f.cancel(true);
            return failure(component, "probe timed out after %d ms".formatted(timeout.toMillis()), "timeout", start);
        } catch (ExecutionException e) {
            var cause = e.getCause() == null ? e : e.getCause();
            return failure(component, String.valueOf(cause.getMessage()), cause.getClass().getSimpleName(), start);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            return failure(component, "probe cancelled", "cancelled", start);
        }
    }

    private ProbeOutcome failure(MonitoredComponent c, String detail, String type, long start) {
        return new ProbeOutcome(c.name(), false, detail, type, since(start));
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @PreDestroy
    void shutdown() {
        probes.shutdownNow();
    }
}
