package org.caureq.selfrepair.service.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.service.store.HealthStore;
import org.caureq.selfrepair.service.store.UnknownComponentException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/** Registered components by name. Registering creates the health row when it does not exist yet. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComponentRegistry {
    private final HealthStore store;
    private final Map<String, MonitoredComponent> components = new ConcurrentSkipListMap<>();

    public MonitoredComponent register(MonitoredComponent component) {
        store.register(component.name());
        var previous = components.put(component.name(), component);
        if (previous != null) log.info("[Health] component {} re-registered", component.name());
        return component;
    }

    public List<MonitoredComponent> all() { return List.copyOf(components.values()); }

    public Optional<MonitoredComponent> find(String name) { return Optional.ofNullable(components.get(name)); }

    public MonitoredComponent get(String name) {
        return find(name).orElseThrow(() -> new UnknownComponentException(name));
    }
}
