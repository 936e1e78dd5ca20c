package org.caureq.selfrepair.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.api.dto.ComponentStatusDTO;
import org.caureq.selfrepair.service.StatusService;
import org.caureq.selfrepair.service.health.HealthMonitor;
import org.caureq.selfrepair.service.integrity.IntegrityException;
import org.caureq.selfrepair.service.integrity.IntegrityGuard;
import org.caureq.selfrepair.service.integrity.IntegrityWatch;
import org.caureq.selfrepair.service.maintenance.HealthReportService;
import org.caureq.selfrepair.service.maintenance.MaintenanceService;
import org.caureq.selfrepair.service.repair.RepairEscalator;
import org.caureq.selfrepair.service.schedule.ScheduledJobService;
import org.caureq.selfrepair.service.store.UnknownComponentException;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Command surface of the supervisor. Exit codes: 0 success, 1 failure or negative result, 2 usage error.
 */
@Component
@RequiredArgsConstructor
@Command(
        name = "self-repair",
        mixinStandardHelpOptions = true,
        description = "Progressive self-repair supervisor",
        subcommands = {
                SupervisorCommand.HealthMonitorCommand.class,
                SupervisorCommand.StatusCommand.class,
                SupervisorCommand.InstallScheduleCommand.class,
                SupervisorCommand.RemoveScheduleCommand.class,
                SupervisorCommand.CleanupLogsCommand.class,
                SupervisorCommand.CleanupBackupsCommand.class,
                SupervisorCommand.BackupCommand.class,
                SupervisorCommand.RestoreCommand.class,
                SupervisorCommand.VerifyCommand.class,
                SupervisorCommand.ReportCommand.class,
                SupervisorCommand.AckCommand.class
        }
)
public class SupervisorCommand implements Callable<Integer> {
    final HealthMonitor monitor;
    final RepairEscalator escalator;
    final StatusService status;
    final ScheduledJobService jobs;
    final MaintenanceService maintenance;
    final IntegrityGuard guard;
    final IntegrityWatch watch;
    final HealthReportService reports;
    final ObjectMapper om;

    @Spec
    CommandLine.Model.CommandSpec spec;

    public CommandLine commandLine() {
        var cl = new CommandLine(this);
        cl.setExecutionExceptionHandler((ex, line, parsed) -> {
            var err = line.getErr();
            if (ex instanceof IntegrityException || ex instanceof UnknownComponentException || ex instanceof IllegalArgumentException) {
                err.println("error: " + ex.getMessage());
            } else {
                err.println("error: " + ex);
                ex.printStackTrace(err);
            }
            return CommandLine.ExitCode.SOFTWARE;
        });
        return cl;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return CommandLine.ExitCode.USAGE;
    }

    PrintWriter out() { return spec.commandLine().getOut(); }

    PrintWriter err() { return spec.commandLine().getErr(); }

    void json(Object value) {
        try {
            out().println(om.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render output: " + e.getMessage(), e);
        }
    }

    @Command(name = "health-monitor", description = "Run one health cycle now; exits 1 if any component is unhealthy")
    static final class HealthMonitorCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Option(names = "--wait", description = "How long to wait for dispatched repairs (ISO-8601, default ${DEFAULT-VALUE})",
                defaultValue = "PT5M")
        Duration wait;

        @Override
        public Integer call() {
            var report = parent.monitor.runCycle();
            if (!parent.escalator.awaitIdle(wait)) parent.err().println("repairs still running after " + wait);
            for (var o : report.outcomes()) {
                parent.out().printf("%-24s %-4s %6d ms  %s%n", o.component(), o.healthy() ? "ok" : "FAIL",
                        o.elapsed().toMillis(), o.detail() == null ? "" : o.detail());
            }
            if (report.integrity() != null) {
                parent.out().printf("integrity: %d files checked, %d violations%n",
                        report.integrity().filesChecked(), report.integrity().violations().size());
            }
            return report.allHealthy() ? 0 : 1;
        }
    }

    @Command(name = "status", description = "Print the current health of every component")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Option(names = "--json", description = "Print JSON")
        boolean asJson;

        @Override
        public Integer call() {
            var all = parent.status.all();
            if (asJson) {
                parent.json(all.stream().map(ComponentStatusDTO::of).toList());
                return 0;
            }
            parent.out().printf("%-24s %-9s %-9s %5s %7s %8s  %-9s %s%n",
                    "COMPONENT", "STATUS", "FRESHNESS", "CONS", "TOTAL", "UPTIME", "REPAIR", "LAST CHECK");
            for (var s : all) {
                var h = s.health();
                parent.out().printf("%-24s %-9s %-9s %5d %7d %7.2f%%  %-9s %s%n",
                        h.getComponentName(), h.getStatus().dbValue(), s.freshness().name(),
                        h.getConsecutiveFailures(), h.getTotalFailures(), h.getUptimePercentage(),
                        h.getRepairState().name(), h.getLastCheck() == null ? "never" : h.getLastCheck());
            }
            return 0;
        }
    }

    @Command(name = "install-schedule", description = "Enable the periodic jobs")
    static final class InstallScheduleCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Override
        public Integer call() {
            for (var job : parent.jobs.installDefaults()) {
                parent.out().printf("%-18s %s every %d s%n", job.getName(), job.isEnabled() ? "enabled" : "disabled",
                        job.getIntervalSeconds());
            }
            return 0;
        }
    }

    @Command(name = "remove-schedule", description = "Disable the periodic jobs")
    static final class RemoveScheduleCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Override
        public Integer call() {
            parent.out().println("disabled " + parent.jobs.remove() + " jobs");
            return 0;
        }
    }

    @Command(name = "cleanup-logs", description = "Delete log files older than the retention age")
    static final class CleanupLogsCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Override
        public Integer call() {
            var r = parent.maintenance.cleanupLogs();
            parent.out().printf("deleted %d files (%d bytes)%n", r.filesDeleted(), r.bytesFreed());
            r.errors().forEach(e -> parent.err().println("error: " + e));
            return r.ok() ? 0 : 1;
        }
    }

    @Command(name = "cleanup-backups", description = "Prune snapshots beyond the keep count")
    static final class CleanupBackupsCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Override
        public Integer call() {
            parent.out().println("pruned " + parent.maintenance.cleanupBackups() + " snapshots");
            return 0;
        }
    }

    @Command(name = "backup", description = "Snapshot the protected files")
    static final class BackupCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Override
        public Integer call() {
            var m = parent.guard.snapshot();
            parent.out().printf("snapshot %s: %d files%n", m.id(), m.entries().size());
            return 0;
        }
    }

    @Command(name = "restore", description = "Restore the protected files from a snapshot")
    static final class RestoreCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Parameters(index = "0", paramLabel = "SNAPSHOT", description = "Snapshot id or 'latest'")
        String snapshotId;

        @Override
        public Integer call() {
            var r = parent.guard.restore(snapshotId);
            parent.out().printf("restored %d files from snapshot %s%n", r.restoredPaths().size(), r.snapshotId());
            parent.watch.check();
            return 0;
        }
    }

    @Command(name = "verify", description = "Compare the protected files with the latest snapshot; exits 1 on any violation")
    static final class VerifyCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Override
        public Integer call() {
            var r = parent.guard.verify();
            parent.out().printf("snapshot %s: %d files checked%n", r.snapshotId(), r.filesChecked());
            for (var m : r.mismatches()) {
                parent.out().printf("%-10s %s%n", m.kind().name().toLowerCase(), m.path());
            }
            return r.violations().isEmpty() ? 0 : 1;
        }
    }

    @Command(name = "report", description = "Print the system health report as JSON")
    static final class ReportCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Override
        public Integer call() {
            parent.json(parent.reports.current());
            return 0;
        }
    }

    @Command(name = "ack", description = "Acknowledge an alert and return its component to automatic repair")
    static final class AckCommand implements Callable<Integer> {
        @ParentCommand
        SupervisorCommand parent;

        @Parameters(index = "0", paramLabel = "ALERT_ID")
        String alertId;

        @Override
        public Integer call() {
            if (!parent.escalator.acknowledgeAlert(alertId)) {
                parent.err().println("alert not found: " + alertId);
                return 1;
            }
            parent.out().println("acknowledged " + alertId);
            return 0;
        }
    }
}
