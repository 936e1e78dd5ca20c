package org.caureq.selfrepair.service.health;

import org.caureq.selfrepair.domain.HealthStatus;
import org.caureq.selfrepair.service.integrity.IntegrityWatch;
import org.caureq.selfrepair.service.repair.EscalationDecision;
import org.caureq.selfrepair.service.repair.RepairEscalator;
import org.caureq.selfrepair.service.store.InMemoryHealthStore;
import org.caureq.selfrepair.support.MutableClock;
import org.caureq.selfrepair.support.TestProps;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("HealthMonitor")
class HealthMonitorTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryHealthStore store = new InMemoryHealthStore(clock);
    private final ComponentRegistry registry = new ComponentRegistry(store);
    private final RepairEscalator escalator = mock(RepairEscalator.class);
    private final IntegrityWatch integrity = mock(IntegrityWatch.class);
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        when(escalator.onFailure(anyString(), any(), any()))
                .thenAnswer(inv -> EscalationDecision.skipped(inv.getArgument(0), "test"));
        when(integrity.check()).thenReturn(Optional.empty());
        monitor = new HealthMonitor(registry, store, new ProbeRunner(TestProps.defaults()), escalator, integrity,
                TestProps.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        monitor.shutdown();
    }

    @Test
    @DisplayName("A probe that overruns its timeout is recorded as a failure")
    void timeoutCountsAsFailure() {
        // Given
        registry.register(MonitoredComponent.of("slow", t -> {
            Thread.sleep(5_000);
            return ProbeResult.healthy("too late");
        }, null));

        // When
        var report = monitor.runCycle();

        // Then
        var outcome = report.outcomes().get(0);
        assertThat(outcome.healthy()).isFalse();
        assertThat(outcome.timedOut()).isTrue();
        assertThat(outcome.elapsed()).isLessThan(Duration.ofSeconds(3));
        var h = store.find("slow").orElseThrow();
        assertThat(h.getConsecutiveFailures()).isEqualTo(1);
        assertThat(h.getStatus()).isEqualTo(HealthStatus.DEGRADED);
        verify(escalator).onFailure(eq("slow"), anyString(), eq("timeout"));
    }

    @Test
    @DisplayName("A probe that throws is recorded as a failure with the exception type")
    void throwingProbe() {
        registry.register(MonitoredComponent.of("db", t -> {
            throw new IllegalStateException("pool exhausted");
        }, null));

        var outcome = monitor.runCycle().outcomes().get(0);

        assertThat(outcome.healthy()).isFalse();
        assertThat(outcome.errorType()).isEqualTo("IllegalStateException");
        assertThat(outcome.detail()).isEqualTo("pool exhausted");
    }

    @Test
    @DisplayName("Components are probed concurrently")
    void probesRunConcurrently() {
        // Given
        var active = new AtomicInteger();
        var maxActive = new AtomicInteger();
        HealthProbe slow = t -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            Thread.sleep(200);
            active.decrementAndGet();
            return ProbeResult.healthy("ok");
        };
        for (int i = 0; i < 5; i++) registry.register(MonitoredComponent.of("c" + i, slow, null));

        // When
        long start = System.nanoTime();
        var report = monitor.runCycle();
        long tookMs = (System.nanoTime() - start) / 1_000_000;

        // Then
        assertThat(report.allHealthy()).isTrue();
        assertThat(maxActive.get()).isGreaterThan(1);
        assertThat(tookMs).isLessThan(900);
    }

    @Test
    @DisplayName("A success resets the consecutive counter and keeps the lifetime total")
    void successResetsCounter() {
        // Given
        var up = new AtomicBoolean(false);
        registry.register(MonitoredComponent.of("web",
                t -> up.get() ? ProbeResult.healthy("ok") : ProbeResult.unhealthy("503"), null));
        monitor.runCycle();
        monitor.runCycle();
        monitor.runCycle();
        assertThat(store.find("web").orElseThrow().getStatus()).isEqualTo(HealthStatus.FAILING);

        // When
        up.set(true);
        monitor.runCycle();

        // Then
        var h = store.find("web").orElseThrow();
        assertThat(h.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(h.getConsecutiveFailures()).isZero();
        assertThat(h.getTotalFailures()).isEqualTo(3);
        assertThat(h.getUptimePercentage()).isEqualTo(25.0);
        verify(escalator, times(3)).onFailure(eq("web"), eq("503"), eq("unhealthy"));
        verify(escalator).onSuccess("web");
    }

    @Test
    @DisplayName("The integrity check runs after the probes and its report is part of the cycle")
    void cycleIncludesIntegrity() {
        registry.register(MonitoredComponent.of("web", t -> ProbeResult.healthy("ok"), null));

        var report = monitor.runCycle();

        assertThat(report.integrity()).isNull();
        verify(integrity).check();
    }

    @Test
    @DisplayName("An on-demand check probes without recording")
    void checkComponentDoesNotRecord() {
        registry.register(MonitoredComponent.of("web", t -> ProbeResult.unhealthy("503"), null));

        var outcome = monitor.checkComponent("web");

        assertThat(outcome.healthy()).isFalse();
        assertThat(store.find("web").orElseThrow().getProbeCount()).isZero();
        verifyNoInteractions(escalator);
    }
}
