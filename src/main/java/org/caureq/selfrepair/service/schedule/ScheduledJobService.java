package org.caureq.selfrepair.service.schedule;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.domain.ScheduledJob;
import org.caureq.selfrepair.repo.ScheduledJobRepo;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Which periodic jobs are installed, and how their last runs went. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledJobService {
    public static final String HEALTH_CHECK = "health-check";
    public static final String RETENTION_SWEEP = "retention-sweep";
    public static final String METRICS_SNAPSHOT = "metrics-snapshot";

    private final ScheduledJobRepo repo;
    private final Clock clock;
    private final SupervisorProps props;

    /** The three supervisor jobs at their configured intervals. */
    @Transactional
    public List<ScheduledJob> installDefaults() {
        var m = new LinkedHashMap<String, Duration>();
        m.put(HEALTH_CHECK, props.health().interval());
        m.put(RETENTION_SWEEP, props.retention().sweepInterval());
        m.put(METRICS_SNAPSHOT, props.retention().metricsInterval());
        return install(m);
    }

    /** Enables the given jobs, creating rows as needed. Installing twice changes nothing but the intervals. */
    @Transactional
    public List<ScheduledJob> install(Map<String, Duration> intervals) {
        var now = clock.instant();
        intervals.forEach((name, interval) -> {
            var job = repo.findById(name).orElseGet(() -> ScheduledJob.builder().name(name).build());
            if (!job.isEnabled()) {
                job.setEnabled(true);
                job.setInstalledAt(now);
                log.info("[Scheduler] job {} installed (every {})", name, interval);
            }
            job.setIntervalSeconds(interval.toSeconds());
            repo.save(job);
        });
        return list();
    }

    /** @return number of jobs that were enabled */
    @Transactional
    public int remove() {
        int n = 0;
        for (var job : repo.findAll()) {
            if (!job.isEnabled()) continue;
            job.setEnabled(false);
            repo.save(job);
            log.info("[Scheduler] job {} removed", job.getName());
            n++;
        }
        return n;
    }

    public boolean isEnabled(String name) {
        return repo.findById(name).map(ScheduledJob::isEnabled).orElse(false);
    }

    public boolean hasAnyJob() {
        return repo.count() > 0;
    }

    public List<ScheduledJob> list() {
        return repo.findAll(Sort.by("name"));
    }

    @Transactional
    public void recordRun(String name, boolean ok, String error) {
        repo.findById(name).ifPresent(job -> {
            job.setLastRunAt(clock.instant());
            job.setLastRunOk(ok);
            job.setLastError(error == null ? null : error.length() > 1000 ? error.substring(0, 1000) : error);
            job.setRunCount(job.getRunCount() + 1);
            if (!ok) job.setFailureCount(job.getFailureCount() + 1);
            repo.save(job);
        });
    }
}
