package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.service.maintenance.CleanupReport;
import org.caureq.selfrepair.service.maintenance.MaintenanceService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/admin/maintenance")
@RequiredArgsConstructor
public class AdminMaintenanceController {
    private final MaintenanceService maintenance;

    @PostMapping("/logs")
    public CleanupReport logs() {
        return maintenance.cleanupLogs();
    }

    @PostMapping("/backups")
    public Map<String, Integer> backups() {
        return Map.of("snapshotsPruned", maintenance.cleanupBackups());
    }
}
