package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.service.maintenance.HealthReport;
import org.caureq.selfrepair.service.maintenance.HealthReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/report")
@RequiredArgsConstructor
public class ReportController {
    private final HealthReportService reports;

    @GetMapping
    public HealthReport current() {
        return reports.current();
    }

    /** Last hourly metrics snapshot; 404 before the first one. */
    @GetMapping("/last")
    public ResponseEntity<HealthReport> last() {
        return reports.lastSnapshot()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
