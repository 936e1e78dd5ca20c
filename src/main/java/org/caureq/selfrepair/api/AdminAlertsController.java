package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.service.repair.RepairEscalator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Acknowledging an alert hands the component back to automation. */
@RestController
@RequestMapping("/api/admin/alerts")
@RequiredArgsConstructor
public class AdminAlertsController {
    private final RepairEscalator escalator;

    @PostMapping("/{id}/ack")
    public ResponseEntity<?> ack(@PathVariable String id) {
        if (!escalator.acknowledgeAlert(id)) {
            throw new IllegalArgumentException("alert not found: " + id);
        }
        return ResponseEntity.ok(Map.of("acknowledged", id));
    }
}
