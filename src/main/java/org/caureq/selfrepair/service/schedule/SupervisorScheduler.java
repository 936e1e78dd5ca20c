package org.caureq.selfrepair.service.schedule;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.service.health.HealthMonitor;
import org.caureq.selfrepair.service.maintenance.HealthReportService;
import org.caureq.selfrepair.service.maintenance.MaintenanceService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * In-process scheduler for the three periodic jobs. Each job has its own timer; a job that throws
 * is logged and recorded, and the next run happens on schedule. Job failures never reach the
 * repair escalator.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "supervisor.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SupervisorScheduler {
    private final TaskScheduler scheduler;
    private final ScheduledJobService jobs;
    private final List<PeriodicJob> periodic;
    private final boolean autoInstall;
    private final List<ScheduledFuture<?>> handles = new ArrayList<>();

    public SupervisorScheduler(TaskScheduler scheduler, ScheduledJobService jobs, HealthMonitor monitor,
                               MaintenanceService maintenance, HealthReportService reports, SupervisorProps props) {
        this.scheduler = scheduler;
        this.jobs = jobs;
        this.autoInstall = props.scheduler().autoInstall();
        var health = props.health();
        var retention = props.retention();
        this.periodic = List.of(
                PeriodicJob.of(ScheduledJobService.HEALTH_CHECK, health.interval(), health.jitter(), monitor::runCycle),
                new PeriodicJob(ScheduledJobService.RETENTION_SWEEP, retention.sweepInterval(), retention.jitter(), () -> {
                    var sweep = maintenance.retentionSweep();
                    return sweep.ok() ? null : String.join("; ", sweep.allErrors());
                }),
                PeriodicJob.of(ScheduledJobService.METRICS_SNAPSHOT, retention.metricsInterval(), retention.jitter(), reports::snapshot));
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!handles.isEmpty()) return;
        if (autoInstall && !jobs.hasAnyJob()) jobs.installDefaults();
        for (var job : periodic) {
            handles.add(scheduler.schedule(() -> runGuarded(job), new JitteredTrigger(job.interval(), job.jitter())));
            log.info("[Scheduler] {} every {} (jitter {})", job.name(), job.interval(), job.jitter());
        }
    }

    /** Runs one job; nothing it throws, short of a VM error, leaves this method. */
    void runGuarded(PeriodicJob job) {
        try {
            if (!jobs.isEnabled(job.name())) {
                log.debug("[Scheduler] {} not installed, skipping", job.name());
                return;
            }
        } catch (RuntimeException e) {
            log.error("[Scheduler] cannot read installation state of {}: {}", job.name(), e.getMessage());
            return;
        }
        long start = System.nanoTime();
        boolean ok = true;
        String error = null;
        try {
            error = job.task().run();
            if (error != null) {
                ok = false;
                log.warn("[Scheduler] job {} finished with errors: {}", job.name(), error);
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            ok = false;
            error = t.getClass().getSimpleName() + ": " + t.getMessage();
            log.error("[Scheduler] job {} failed", job.name(), t);
        }
        log.debug("[Scheduler] {} finished in {} ms", job.name(), (System.nanoTime() - start) / 1_000_000);
        try {
            jobs.recordRun(job.name(), ok, error);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] cannot record run of {}: {}", job.name(), e.getMessage());
        }
    }

    List<PeriodicJob> jobs() { return periodic; }

    @PreDestroy
    synchronized void stop() {
        handles.forEach(h -> h.cancel(false));
        handles.clear();
    }
}
