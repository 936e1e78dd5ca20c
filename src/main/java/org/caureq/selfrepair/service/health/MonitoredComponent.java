package org.caureq.selfrepair.service.health;

import org.caureq.selfrepair.service.repair.NoopProcessController;
import org.caureq.selfrepair.service.repair.ProcessController;

import java.nio.file.Path;
import java.util.List;

/**
 * A registered component: how to probe it, how to control its process,
 * what tier 1 may clean and which protected paths tier 3 restores.
 */
public record MonitoredComponent(String name,
                                 HealthProbe probe,
                                 ProcessController controller,
                                 RepairPlan plan,
                                 List<Path> protectedPaths) {

    public MonitoredComponent {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("component name is required");
        if (probe == null) throw new IllegalArgumentException("probe is required for " + name);
        if (controller == null) controller = NoopProcessController.INSTANCE;
        if (plan == null) plan = RepairPlan.NONE;
        protectedPaths = protectedPaths == null ? List.of()
                : protectedPaths.stream().map(p -> p.toAbsolutePath().normalize()).toList();
    }

    public static MonitoredComponent of(String name, HealthProbe probe, ProcessController controller) {
        return new MonitoredComponent(name, probe, controller, RepairPlan.NONE, List.of());
    }

    public boolean owns(Path path) {
        var p = path.toAbsolutePath().normalize();
        return protectedPaths.stream().anyMatch(p::startsWith);
    }
}
