package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.service.alerts.AlertRegistry;
import org.caureq.selfrepair.service.alerts.AlertService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Alerts read controller: list and filter alerts.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertsController {
    private final AlertService alerts;

    @GetMapping
    public List<AlertRegistry.Alert> list(
            @RequestParam(value = "component", required = false) String component,
            @RequestParam(value = "ack", required = false) Boolean ack,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        int lim = (limit == null ? 50 : limit);
        int off = (offset == null ? 0 : offset);
        return alerts.query(component, ack, lim, off);
    }
}
