package org.caureq.selfrepair.config;

import org.caureq.selfrepair.domain.StatusThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "supervisor")
public record SupervisorProps(String apiKey,
                              @DefaultValue("jpa") String store,
                              @DefaultValue HealthProps health,
                              @DefaultValue RepairProps repair,
                              @DefaultValue IntegrityProps integrity,
                              @DefaultValue RetentionProps retention,
                              @DefaultValue AlertsProps alerts,
                              @DefaultValue SchedulerProps scheduler,
                              @DefaultValue List<ComponentProps> components) {

    /** Probe cadence, timeouts and status thresholds */
    public record HealthProps(@DefaultValue("5m") Duration interval,
                              @DefaultValue("30s") Duration jitter,
                              @DefaultValue("5s") Duration probeTimeout,
                              @DefaultValue("50") int maxConcurrentProbes,
                              @DefaultValue("10s") Duration shutdownGrace,
                              @DefaultValue("1") int degradedAt,
                              @DefaultValue("3") int failingAt,
                              @DefaultValue("6") int criticalAt,
                              @DefaultValue("2") int staleFactor) {
        public StatusThresholds thresholds() {
            return new StatusThresholds(degradedAt, failingAt, criticalAt);
        }
    }

    /** Per-tier timeouts and restart guard rails */
    public record RepairProps(@DefaultValue("30s") Duration tier1Timeout,
                              @DefaultValue("60s") Duration tier2Timeout,
                              @DefaultValue("120s") Duration tier3Timeout,
                              @DefaultValue("60s") Duration restartGrace,
                              @DefaultValue("5s") Duration validationDelay,
                              @DefaultValue("5") int maxRestartsPerHour,
                              @DefaultValue SafetyProps safety) {}

    /** Checks made before any repair action; a failed check refuses the repair */
    public record SafetyProps(@DefaultValue("true") boolean enabled,
                              @DefaultValue("90") double maxMemoryPct,
                              @DefaultValue("95") double maxDiskPct,
                              @DefaultValue("/") String diskPath,
                              @DefaultValue("3") int maxRecentRepairs,
                              @DefaultValue("5m") Duration recentWindow) {}

    public record IntegrityProps(@DefaultValue List<String> protectedPaths,
                                 @DefaultValue("data/backups") String backupDir,
                                 @DefaultValue("10") int keep) {}

    /** repairLog defaults to three years of audit history */
    public record RetentionProps(@DefaultValue("1095d") Duration repairLog,
                                 @DefaultValue List<String> logDirs,
                                 @DefaultValue("14d") Duration logMaxAge,
                                 @DefaultValue("24h") Duration sweepInterval,
                                 @DefaultValue("1h") Duration metricsInterval,
                                 @DefaultValue("5m") Duration jitter) {}

    public record AlertsProps(String webhookUrl,
                              @DefaultValue("10s") Duration timeout) {}

    public record SchedulerProps(@DefaultValue("true") boolean enabled,
                                 @DefaultValue("true") boolean autoInstall) {}

    /** One monitored component as declared in configuration */
    public record ComponentProps(String name,
                                 @DefaultValue ProbeProps probe,
                                 @DefaultValue CommandProps commands,
                                 @DefaultValue List<String> cacheDirs,
                                 @DefaultValue List<String> logFiles,
                                 @DefaultValue("10485760") long maxLogBytes,
                                 @DefaultValue List<String> protectedPaths) {}

    /** type: tcp | http | disk | memory | command | passive */
    public record ProbeProps(@DefaultValue("passive") String type,
                             String target,
                             @DefaultValue("90") double thresholdPct) {}

    public record CommandProps(String start, String stop, String restart, String reload, String health) {
        public boolean any() {
            return isSet(start) || isSet(stop) || isSet(restart) || isSet(reload) || isSet(health);
        }

        private static boolean isSet(String s) { return s != null && !s.isBlank(); }
    }
}
