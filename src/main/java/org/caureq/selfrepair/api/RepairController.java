package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.api.dto.RepairAttemptDTO;
import org.caureq.selfrepair.service.store.HealthStore;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Repair log, newest first. */
@RestController
@RequestMapping("/api/repairs")
@RequiredArgsConstructor
public class RepairController {
    private final HealthStore store;

    @GetMapping
    public List<RepairAttemptDTO> list(
            @RequestParam(value = "component", required = false) String component,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        int lim = (limit == null ? 50 : limit);
        int off = (offset == null ? 0 : offset);
        return store.attempts(component, lim, off).stream().map(RepairAttemptDTO::of).toList();
    }
}
