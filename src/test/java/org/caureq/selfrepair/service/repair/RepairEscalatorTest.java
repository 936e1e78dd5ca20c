package org.caureq.selfrepair.service.repair;

import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.domain.HealthStatus;
import org.caureq.selfrepair.domain.RepairAttempt;
import org.caureq.selfrepair.domain.RepairOutcome;
import org.caureq.selfrepair.domain.RepairState;
import org.caureq.selfrepair.service.alerts.AlertRegistry;
import org.caureq.selfrepair.service.alerts.AlertService;
import org.caureq.selfrepair.service.alerts.AlertSink;
import org.caureq.selfrepair.service.alerts.IncidentContext;
import org.caureq.selfrepair.service.health.ComponentRegistry;
import org.caureq.selfrepair.service.health.HealthMonitor;
import org.caureq.selfrepair.service.health.MonitoredComponent;
import org.caureq.selfrepair.service.health.ProbeResult;
import org.caureq.selfrepair.service.health.ProbeRunner;
import org.caureq.selfrepair.service.health.RepairPlan;
import org.caureq.selfrepair.service.integrity.IntegrityGuard;
import org.caureq.selfrepair.service.integrity.IntegrityWatch;
import org.caureq.selfrepair.service.integrity.PathMismatch;
import org.caureq.selfrepair.service.store.InMemoryHealthStore;
import org.caureq.selfrepair.support.FakeController;
import org.caureq.selfrepair.support.MutableClock;
import org.caureq.selfrepair.support.TestProps;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("RepairEscalator")
class RepairEscalatorTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    @TempDir
    Path tmp;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryHealthStore store = new InMemoryHealthStore(clock);
    private final ComponentRegistry registry = new ComponentRegistry(store);
    private final AlertService alerts = mock(AlertService.class);
    private final AtomicBoolean up = new AtomicBoolean(false);
    private IntegrityGuard guard;
    private RepairEscalator escalator;
    private HealthMonitor monitor;

    private void start(SupervisorProps props) {
        start(props, alerts);
    }

    private void start(SupervisorProps props, AlertService alertService) {
        guard = new IntegrityGuard(List.of(tmp.resolve("etc")), tmp.resolve("backups"), 5, clock);
        var safety = new RepairSafetyGate(disk -> new HostResources.Usage(10, 10), store, props, clock);
        var executor = new RepairExecutor(guard, new ProbeRunner(TestProps.defaults()), store, safety, props, clock);
        escalator = new RepairEscalator(store, registry, executor, alertService, props, clock);
        var watch = mock(IntegrityWatch.class);
        when(watch.check()).thenReturn(Optional.empty());
        monitor = new HealthMonitor(registry, store, new ProbeRunner(TestProps.defaults()), escalator, watch, props, clock);
    }

    @AfterEach
    void tearDown() {
        if (escalator != null) escalator.shutdown();
    }

    private MonitoredComponent web(FakeController controller) {
        return registry.register(MonitoredComponent.of("web",
                t -> up.get() ? ProbeResult.healthy("200 OK") : ProbeResult.unhealthy("connection refused"), controller));
    }

    private void cycle() {
        monitor.runCycle();
        assertThat(escalator.awaitIdle(WAIT)).isTrue();
    }

    private HealthStatus status() {
        return store.find("web").orElseThrow().getStatus();
    }

    private List<RepairAttempt> attemptsOldestFirst() {
        var attempts = new ArrayList<>(store.attempts("web", 50, 0));
        Collections.reverse(attempts);
        return attempts;
    }

    @Test
    @DisplayName("A component that stays down climbs tier 1, 2, 3 and raises exactly one alert")
    void escalatesThroughAllTiers() {
        // Given
        start(TestProps.of(TestProps.health(1, 2, 3), TestProps.repair(Duration.ZERO, 5)));
        var controller = new FakeController();
        web(controller);

        // When / Then
        cycle();
        assertThat(status()).isEqualTo(HealthStatus.DEGRADED);
        cycle();
        assertThat(status()).isEqualTo(HealthStatus.FAILING);
        cycle();
        assertThat(status()).isEqualTo(HealthStatus.CRITICAL);
        cycle();

        var attempts = attemptsOldestFirst();
        assertThat(attempts).extracting(RepairAttempt::getRepairTier).containsExactly(1, 2, 3);
        assertThat(attempts).extracting(RepairAttempt::getRepairOutcome)
                .containsOnly(RepairOutcome.FAILURE);
        assertThat(attempts).extracting(RepairAttempt::getIncidentId).containsOnly(attempts.get(0).getIncidentId());
        assertThat(controller.restarts).hasValue(1);

        var h = store.find("web").orElseThrow();
        assertThat(h.getRepairState()).isEqualTo(RepairState.EXHAUSTED);
        assertThat(h.getConsecutiveFailures()).isEqualTo(4);

        var incident = ArgumentCaptor.forClass(IncidentContext.class);
        verify(alerts, times(1)).raise(incident.capture());
        assertThat(incident.getValue().type()).isEqualTo(IncidentContext.REPAIR_EXHAUSTED);
        assertThat(incident.getValue().attempts()).hasSize(3);
    }

    @Test
    @DisplayName("Every attempt is in the repair log before its action runs")
    void attemptWrittenBeforeAction() throws Exception {
        // Given
        start(TestProps.defaults());
        var seenDuringReload = new AtomicBoolean();
        web(new FakeController() {
            @Override
            public ControlResult reload(Duration timeout) {
                seenDuringReload.set(store.attempts("web", 10, 0).size() == 1
                        && !store.attempts("web", 10, 0).get(0).isCompleted());
                return super.reload(timeout);
            }
        });

        // When
        var decision = escalator.onFailure("web", "connection refused", "unhealthy");
        var done = decision.completion().get(5, TimeUnit.SECONDS);

        // Then
        assertThat(decision.attempt().getId()).isNotNull();
        assertThat(seenDuringReload).isTrue();
        assertThat(done.getRepairOutcome()).isEqualTo(RepairOutcome.FAILURE);
        assertThat(done.getRepairDurationSeconds()).isNotNull();
        assertThat(done.getErrorContext()).contains("\"errorType\":\"unhealthy\"");
    }

    @Test
    @DisplayName("Recovery between failures closes the incident and the next failure starts over at tier 1")
    void recoveryResetsTheLadder() {
        // Given
        start(TestProps.defaults());
        web(new FakeController());

        // When
        cycle();
        up.set(true);
        cycle();

        // Then
        var recovered = store.find("web").orElseThrow();
        assertThat(recovered.getConsecutiveFailures()).isZero();
        assertThat(recovered.getRepairState()).isEqualTo(RepairState.IDLE);
        assertThat(attemptsOldestFirst()).singleElement()
                .satisfies(a -> assertThat(a.getResolvedAt()).isNotNull());

        // When
        up.set(false);
        cycle();

        // Then
        var attempts = attemptsOldestFirst();
        assertThat(attempts).extracting(RepairAttempt::getRepairTier).containsExactly(1, 1);
        assertThat(attempts.get(0).getIncidentId()).isNotEqualTo(attempts.get(1).getIncidentId());
        assertThat(attempts.get(0).getResolvedAt()).isNotNull();
        assertThat(store.find("web").orElseThrow().getRepairState()).isEqualTo(RepairState.TIER1);
    }

    @Test
    @DisplayName("A repair that passes validation restores the component to healthy")
    void validatedRepairClosesIncident() {
        // Given
        start(TestProps.defaults());
        web(new FakeController() {
            @Override
            public ControlResult reload(Duration timeout) {
                up.set(true);
                return super.reload(timeout);
            }
        });

        // When
        cycle();

        // Then
        var h = store.find("web").orElseThrow();
        assertThat(h.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(h.getConsecutiveFailures()).isZero();
        assertThat(h.getTotalFailures()).isEqualTo(1);
        assertThat(h.getRepairState()).isEqualTo(RepairState.IDLE);
        assertThat(h.getIncidentId()).isNull();
        assertThat(h.getRecoveryCount()).isEqualTo(1);
        var attempt = attemptsOldestFirst().get(0);
        assertThat(attempt.getRepairOutcome()).isEqualTo(RepairOutcome.SUCCESS);
        assertThat(attempt.getResolvedAt()).isNotNull();
        verifyNoInteractions(alerts);
    }

    @Test
    @DisplayName("Failures inside the restart grace period are not new observations")
    void restartGraceSuppressesEscalation() {
        // Given
        start(TestProps.of(TestProps.health(1, 3, 6), TestProps.repair(Duration.ofSeconds(60), 5)));
        web(new FakeController());
        cycle();
        cycle();

        // When
        clock.advance(Duration.ofSeconds(30));
        cycle();

        // Then
        assertThat(attemptsOldestFirst()).extracting(RepairAttempt::getRepairTier).containsExactly(1, 2);

        // When
        clock.advance(Duration.ofSeconds(31));
        cycle();

        // Then
        assertThat(attemptsOldestFirst()).extracting(RepairAttempt::getRepairTier).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("A failure observed while a repair runs does not escalate")
    void inFlightRepairIsNotDuplicated() throws Exception {
        // Given
        start(TestProps.defaults());
        var release = new CountDownLatch(1);
        web(new FakeController() {
            @Override
            public ControlResult reload(Duration timeout) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.reload(timeout);
            }
        });
        var first = escalator.onFailure("web", "connection refused", "unhealthy");

        // When
        var second = escalator.onFailure("web", "connection refused", "unhealthy");

        // Then
        assertThat(first.action()).isEqualTo(EscalationDecision.Action.REPAIR);
        assertThat(second.action()).isEqualTo(EscalationDecision.Action.SKIPPED);
        assertThat(second.reason()).contains("already running");
        assertThat(escalator.isRepairing("web")).isTrue();

        release.countDown();
        first.completion().get(5, TimeUnit.SECONDS);
        assertThat(escalator.isRepairing("web")).isFalse();
        assertThat(store.attempts("web", 10, 0)).hasSize(1);
    }

    @Test
    @DisplayName("An exhausted incident waits for acknowledgement, then the ladder restarts at tier 1")
    void exhaustedUntilAcknowledged() throws Exception {
        // Given
        start(TestProps.defaults());
        web(new FakeController());
        for (int i = 0; i < 3; i++) {
            escalator.onFailure("web", "connection refused", "unhealthy").completion().get(5, TimeUnit.SECONDS);
        }
        assertThat(store.find("web").orElseThrow().getRepairState()).isEqualTo(RepairState.EXHAUSTED);

        // When
        var skipped = escalator.onFailure("web", "connection refused", "unhealthy");

        // Then
        assertThat(skipped.action()).isEqualTo(EscalationDecision.Action.SKIPPED);

        // When
        when(alerts.acknowledge("alert-1")).thenReturn(Optional.of(new AlertRegistry.Alert("alert-1", "web",
                IncidentContext.REPAIR_EXHAUSTED, "exhausted", clock.instant(), true, clock.instant())));
        assertThat(escalator.acknowledgeAlert("alert-1")).isTrue();
        var next = escalator.onFailure("web", "connection refused", "unhealthy");
        next.completion().get(5, TimeUnit.SECONDS);

        // Then
        assertThat(next.action()).isEqualTo(EscalationDecision.Action.REPAIR);
        assertThat(next.attempt().getRepairTier()).isEqualTo(1);
        assertThat(store.attempts("web", 10, 0).get(1).getResolvedAt()).isNotNull();
    }

    @Test
    @DisplayName("Acknowledging an unknown alert changes nothing")
    void unknownAlert() {
        start(TestProps.defaults());
        when(alerts.acknowledge("nope")).thenReturn(Optional.empty());

        assertThat(escalator.acknowledgeAlert("nope")).isFalse();
    }

    @Test
    @DisplayName("Modified protected files skip tiers 1 and 2 and are restored from the snapshot")
    void integrityViolationGoesStraightToTierThree() throws IOException {
        // Given
        start(TestProps.defaults());
        var etc = Files.createDirectories(tmp.resolve("etc"));
        var conf = Files.writeString(etc.resolve("app.conf"), "port=8080\n");
        up.set(true);
        var controller = new FakeController();
        registry.register(new MonitoredComponent("web", t -> ProbeResult.healthy("200 OK"), controller,
                RepairPlan.NONE, List.of(etc)));
        guard.snapshot();
        var watch = new IntegrityWatch(guard, registry, escalator, store);
        Files.writeString(conf, "port=31337\n");

        // When
        watch.check();
        assertThat(escalator.awaitIdle(WAIT)).isTrue();

        // Then
        var attempts = attemptsOldestFirst();
        assertThat(attempts).hasSize(1);
        assertThat(attempts.get(0).getRepairTier()).isEqualTo(3);
        assertThat(attempts.get(0).getErrorType()).isEqualTo("integrity_violation");
        assertThat(attempts.get(0).getRepairOutcome()).isEqualTo(RepairOutcome.SUCCESS);
        assertThat(Files.readString(conf)).isEqualTo("port=8080\n");
        assertThat(controller.restarts).hasValue(1);
        var h = store.find("web").orElseThrow();
        assertThat(h.isIntegrityViolation()).isFalse();
        assertThat(h.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(watch.check().orElseThrow().violations()).isEmpty();
    }

    @Test
    @DisplayName("A violation that persists is critical and does not close on a passing probe")
    void integrityIncidentSurvivesHealthyProbe() {
        // Given
        start(TestProps.defaults());
        registry.register(MonitoredComponent.of("web", t -> ProbeResult.healthy("200 OK"), new FakeController()));
        var mismatch = new PathMismatch("/etc/app.conf", PathMismatch.Kind.MODIFIED, "aa", "bb");

        // When
        var decision = escalator.onIntegrityViolation("web", List.of(mismatch));
        assertThat(escalator.awaitIdle(WAIT)).isTrue();

        // Then
        assertThat(decision.attempt().getRepairTier()).isEqualTo(3);
        var h = store.find("web").orElseThrow();
        assertThat(h.getRepairState()).isEqualTo(RepairState.EXHAUSTED);
        assertThat(h.getStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(escalator.onSuccess("web")).isFalse();
        verify(alerts).raise(any());
    }

    @Test
    @DisplayName("A slow alert sink does not stall the next health cycle")
    void slowAlertSinkDoesNotStallCycle() throws Exception {
        // Given
        var props = TestProps.defaults();
        var alertRegistry = mock(AlertRegistry.class);
        when(alertRegistry.add(any())).thenReturn(new AlertRegistry.Alert("alert-1", "web",
                IncidentContext.REPAIR_EXHAUSTED, "exhausted", clock.instant(), false, null));
        var release = new CountDownLatch(1);
        var delivered = new CountDownLatch(1);
        AlertSink slowSink = (component, incident) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.countDown();
        };
        var alertService = new AlertService(alertRegistry, slowSink, props);
        start(props, alertService);
        web(new FakeController());
        escalator.onFailure("web", "connection refused", "unhealthy").completion().get(5, TimeUnit.SECONDS);
        escalator.onFailure("web", "connection refused", "unhealthy").completion().get(5, TimeUnit.SECONDS);

        try {
            // When
            var tierThree = escalator.onFailure("web", "connection refused", "unhealthy");
            long start = System.nanoTime();
            monitor.runCycle();
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            tierThree.completion().get(5, TimeUnit.SECONDS);

            // Then
            assertThat(tookMs).isLessThan(1500);
            assertThat(store.find("web").orElseThrow().getRepairState()).isEqualTo(RepairState.EXHAUSTED);
            verify(alertRegistry, times(1)).add(any());
            assertThat(delivered.getCount()).isEqualTo(1);
        } finally {
            release.countDown();
        }
        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Shutdown refuses new repairs and lets the running one finish and be recorded")
    void shutdownDrainsRunningRepair() throws Exception {
        // Given
        start(TestProps.defaults());
        var release = new CountDownLatch(1);
        web(new FakeController() {
            @Override
            public ControlResult reload(Duration timeout) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.reload(timeout);
            }
        });
        registry.register(MonitoredComponent.of("api", t -> ProbeResult.unhealthy("503"), new FakeController()));
        var running = escalator.onFailure("web", "connection refused", "unhealthy");

        // When
        escalator.stopAccepting();
        var refused = escalator.onFailure("api", "503", "unhealthy");
        var refusedIntegrity = escalator.onIntegrityViolation("api",
                List.of(new PathMismatch("/etc/api.conf", PathMismatch.Kind.MODIFIED, "aa", "bb")));
        var releaser = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            release.countDown();
        });
        releaser.start();
        escalator.shutdown();

        // Then
        assertThat(refused.action()).isEqualTo(EscalationDecision.Action.SKIPPED);
        assertThat(refused.reason()).contains("shutting down");
        assertThat(refusedIntegrity.action()).isEqualTo(EscalationDecision.Action.SKIPPED);
        assertThat(store.attempts("api", 10, 0)).isEmpty();
        assertThat(running.completion()).isDone();
        var recorded = store.attempts("web", 10, 0);
        assertThat(recorded).singleElement().satisfies(a -> {
            assertThat(a.isCompleted()).isTrue();
            assertThat(a.getRepairOutcome()).isEqualTo(RepairOutcome.FAILURE);
        });
        assertThat(escalator.isRepairing("web")).isFalse();
    }
}
