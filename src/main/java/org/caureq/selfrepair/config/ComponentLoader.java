package org.caureq.selfrepair.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.service.health.ComponentRegistry;
import org.caureq.selfrepair.service.health.HealthProbe;
import org.caureq.selfrepair.service.health.MonitoredComponent;
import org.caureq.selfrepair.service.health.RepairPlan;
import org.caureq.selfrepair.service.health.probe.*;
import org.caureq.selfrepair.service.integrity.IntegrityGuard;
import org.caureq.selfrepair.service.integrity.IntegrityWatch;
import org.caureq.selfrepair.service.repair.CommandProcessController;
import org.caureq.selfrepair.service.repair.NoopProcessController;
import org.caureq.selfrepair.service.repair.ProcessController;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/** Registers the components declared under {@code supervisor.components}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ComponentLoader {
    private final SupervisorProps props;
    private final ComponentRegistry registry;
    private final IntegrityGuard guard;
    private final WebClient supervisorWebClient;

    @PostConstruct
    void load() {
        for (var cp : props.components()) {
            registry.register(build(cp));
        }
        if (guard.hasProtectedPaths()) {
            registry.register(new MonitoredComponent(IntegrityWatch.GUARD_COMPONENT, PassiveProbe.INSTANCE,
                    NoopProcessController.INSTANCE, RepairPlan.NONE, guard.protectedPaths()));
        }
        log.info("[Health] {} components registered", registry.all().size());
    }

    MonitoredComponent build(SupervisorProps.ComponentProps cp) {
        if (cp.name() == null || cp.name().isBlank()) throw new IllegalArgumentException("component without a name");
        if (IntegrityWatch.GUARD_COMPONENT.equals(cp.name())) {
            throw new IllegalArgumentException("component name is reserved: " + cp.name());
        }
        ProcessController controller = cp.commands().any()
                ? new CommandProcessController(cp.name(), cp.commands())
                : NoopProcessController.INSTANCE;
        var plan = new RepairPlan(paths(cp.cacheDirs()), paths(cp.logFiles()), cp.maxLogBytes());
        return new MonitoredComponent(cp.name(), probe(cp, controller), controller, plan, paths(cp.protectedPaths()));
    }

    private HealthProbe probe(SupervisorProps.ComponentProps cp, ProcessController controller) {
        var p = cp.probe();
        var type = p.type() == null ? "passive" : p.type().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "tcp" -> TcpProbe.parse(required(cp, p.target()));
            case "http" -> new HttpProbe(supervisorWebClient, required(cp, p.target()));
            case "disk" -> new DiskSpaceProbe(Path.of(p.target() == null ? "." : p.target()), p.thresholdPct());
            case "memory" -> new MemoryProbe(p.thresholdPct());
            case "command" -> new CommandProbe(controller);
            case "passive" -> PassiveProbe.INSTANCE;
            default -> throw new IllegalArgumentException("unknown probe type '%s' for %s".formatted(p.type(), cp.name()));
        };
    }

    private static String required(SupervisorProps.ComponentProps cp, String target) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("probe target is required for " + cp.name());
        }
        return target;
    }

    private static List<Path> paths(List<String> raw) {
        return raw.stream().map(Path::of).toList();
    }
}
