package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.service.integrity.*;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Snapshot, verify and restore the protected set. */
@Slf4j
@RestController
@RequestMapping("/api/admin/integrity")
@RequiredArgsConstructor
public class AdminIntegrityController {
    private final IntegrityGuard guard;
    private final IntegrityWatch watch;

    @PostMapping("/snapshot")
    public SnapshotManifest snapshot() {
        return guard.snapshot();
    }

    @GetMapping("/snapshots")
    public List<SnapshotManifest> snapshots() {
        return guard.listSnapshots();
    }

    @GetMapping("/verify")
    public VerificationReport verify() {
        return guard.verify();
    }

    /** {@code id} may be {@code latest}. Re-runs the integrity check so cleared violations close. */
    @PostMapping("/restore/{id}")
    public RestoreReport restore(@PathVariable String id) {
        var report = guard.restore(id);
        log.info("[Integrity] restore of {} requested through the API", report.snapshotId());
        watch.check();
        return report;
    }
}
