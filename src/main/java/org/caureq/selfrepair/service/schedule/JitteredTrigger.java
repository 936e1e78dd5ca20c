package org.caureq.selfrepair.service.schedule;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Fixed delay between the end of one run and the start of the next, shifted by a random
 * amount in [-jitter, +jitter]. The first run starts within one jitter of scheduling.
 */
public class JitteredTrigger implements Trigger {
    private final Duration interval;
    private final Duration jitter;

    public JitteredTrigger(Duration interval, Duration jitter) {
        if (interval.isZero() || interval.isNegative()) throw new IllegalArgumentException("interval must be positive");
        this.interval = interval;
        this.jitter = jitter == null || jitter.isNegative() ? Duration.ZERO : jitter;
    }

    @Override
    public Instant nextExecution(TriggerContext ctx) {
        var last = ctx.lastCompletion();
        var now = ctx.getClock().instant();
        if (last == null) return now.plusMillis(random(0, jitter.toMillis()));
        long shift = random(-jitter.toMillis(), jitter.toMillis());
        var next = last.plus(interval).plusMillis(shift);
        // never closer than half an interval to the previous run
        var floor = last.plus(interval.dividedBy(2));
        return next.isBefore(floor) ? floor : next;
    }

    private static long random(long from, long to) {
        return to <= from ? from : ThreadLocalRandom.current().nextLong(from, to + 1);
    }
}
