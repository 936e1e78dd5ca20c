package org.caureq.selfrepair.service.schedule;

import java.time.Duration;

public record PeriodicJob(String name, Duration interval, Duration jitter, Task task) {

    /** One run of a job. */
    @FunctionalInterface
    public interface Task {
        /** @return what went wrong in a run that did not throw, or null when the run was clean */
        String run();
    }

    /** A job whose run is clean unless it throws. */
    public static PeriodicJob of(String name, Duration interval, Duration jitter, Runnable task) {
        return new PeriodicJob(name, interval, jitter, () -> {
            task.run();
            return null;
        });
    }
}
