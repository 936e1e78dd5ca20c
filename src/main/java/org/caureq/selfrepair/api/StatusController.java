package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.api.dto.ComponentStatusDTO;
import org.caureq.selfrepair.service.StatusService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Last known health of each component. A STALE freshness with an old lastCheck means probes
 * have stopped, not that the component recovered.
 */
@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {
    private final StatusService status;

    @GetMapping
    public List<ComponentStatusDTO> all() {
        return status.all().stream().map(ComponentStatusDTO::of).toList();
    }

    @GetMapping("/{component}")
    public ComponentStatusDTO one(@PathVariable String component) {
        return ComponentStatusDTO.of(status.one(component));
    }
}
