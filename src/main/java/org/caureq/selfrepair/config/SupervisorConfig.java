package org.caureq.selfrepair.config;

import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.service.alerts.AlertSink;
import org.caureq.selfrepair.service.alerts.LoggingAlertSink;
import org.caureq.selfrepair.service.alerts.WebhookAlertSink;
import org.caureq.selfrepair.service.integrity.IntegrityGuard;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;

@Slf4j
@Configuration
public class SupervisorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IntegrityGuard integrityGuard(SupervisorProps props, Clock clock) {
        var integrity = props.integrity();
        var paths = integrity.protectedPaths().stream().map(Path::of).toList();
        log.info("[Integrity] {} protected paths, snapshots in {} (keep {})", paths.size(), integrity.backupDir(), integrity.keep());
        return new IntegrityGuard(paths, Path.of(integrity.backupDir()), integrity.keep(), clock);
    }

    @Bean
    public AlertSink alertSink(SupervisorProps props, WebClient supervisorWebClient) {
        var alerts = props.alerts();
        if (alerts.webhookUrl() == null || alerts.webhookUrl().isBlank()) {
            log.info("[Alerts] no webhook configured, alerts go to the log only");
            return new LoggingAlertSink();
        }
        return new WebhookAlertSink(supervisorWebClient, alerts.webhookUrl(), alerts.timeout());
    }

    /** One thread per periodic job. */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler supervisorTaskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
