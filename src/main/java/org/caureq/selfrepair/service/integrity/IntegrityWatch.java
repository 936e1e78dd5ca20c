package org.caureq.selfrepair.service.integrity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.service.health.ComponentRegistry;
import org.caureq.selfrepair.service.health.MonitoredComponent;
import org.caureq.selfrepair.service.repair.RepairEscalator;
import org.caureq.selfrepair.service.store.HealthStore;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.*;

/**
 * Verifies the protected set against the latest snapshot and routes violations to the component
 * that owns each path. Paths no component declares belong to {@value #GUARD_COMPONENT}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrityWatch {
    public static final String GUARD_COMPONENT = "integrity-guard";

    private final IntegrityGuard guard;
    private final ComponentRegistry registry;
    private final RepairEscalator escalator;
    private final HealthStore store;

    /** @return empty when nothing is protected or no snapshot exists yet */
    public Optional<VerificationReport> check() {
        if (!guard.hasProtectedPaths()) return Optional.empty();
        if (guard.latestSnapshot().isEmpty()) {
            log.debug("[Integrity] no snapshot yet, skipping verification");
            return Optional.empty();
        }
        VerificationReport report;
        try {
            report = guard.verify();
        } catch (IntegrityException e) {
            log.warn("[Integrity] verification failed: {}", e.getMessage());
            return Optional.empty();
        }
        report.mismatches().stream()
                .filter(m -> !m.isViolation())
                .forEach(m -> log.info("[Integrity] file not in snapshot {}: {}", report.snapshotId(), m.path()));

        Map<String, List<PathMismatch>> byOwner = new TreeMap<>();
        for (var m : report.violations()) {
            byOwner.computeIfAbsent(ownerOf(Path.of(m.path())), k -> new ArrayList<>()).add(m);
        }
        byOwner.forEach((component, mismatches) -> {
            if (registry.find(component).isEmpty()) {
                log.error("[Integrity] {} modified files have no registered owner: {}", mismatches.size(), mismatches);
                return;
            }
            escalator.onIntegrityViolation(component, mismatches);
        });
        store.findAll().stream()
                .filter(ComponentHealth::isIntegrityViolation)
                .map(ComponentHealth::getComponentName)
                .filter(name -> !byOwner.containsKey(name))
                .forEach(escalator::onIntegrityCleared);
        return Optional.of(report);
    }

    /** The component declaring the path, preferring real components over the guard. */
    String ownerOf(Path path) {
        return registry.all().stream()
                .filter(c -> !GUARD_COMPONENT.equals(c.name()))
                .filter(c -> c.owns(path))
                .map(MonitoredComponent::name)
                .findFirst()
                .orElse(GUARD_COMPONENT);
    }
}
