package org.caureq.selfrepair.service;

import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.service.store.HealthStore;
import org.caureq.selfrepair.service.store.UnknownComponentException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Last known health of every component, with a freshness flag: a row not probed within
 * {@code stale-factor} intervals points at a stopped scheduler rather than a healthy component.
 */
@Service
public class StatusService {
    public enum Freshness { FRESH, STALE, UNCHECKED }

    public record ComponentStatus(ComponentHealth health, Freshness freshness) {}

    private final HealthStore store;
    private final Duration staleAfter;
    private final Clock clock;

    public StatusService(HealthStore store, SupervisorProps props, Clock clock) {
        this.store = store;
        this.staleAfter = props.health().interval().multipliedBy(Math.max(1, props.health().staleFactor()));
        this.clock = clock;
    }

    public List<ComponentStatus> all() {
        var now = clock.instant();
        return store.findAll().stream().map(h -> new ComponentStatus(h, freshness(h.getLastCheck(), now))).toList();
    }

    public ComponentStatus one(String component) {
        var h = store.find(component).orElseThrow(() -> new UnknownComponentException(component));
        return new ComponentStatus(h, freshness(h.getLastCheck(), clock.instant()));
    }

    Freshness freshness(Instant lastCheck, Instant now) {
        if (lastCheck == null) return Freshness.UNCHECKED;
        return Duration.between(lastCheck, now).compareTo(staleAfter) <= 0 ? Freshness.FRESH : Freshness.STALE;
    }
}
