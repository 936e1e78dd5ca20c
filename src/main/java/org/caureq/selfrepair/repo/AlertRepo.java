package org.caureq.selfrepair.repo;

import org.caureq.selfrepair.domain.AlertRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AlertRepo extends JpaRepository<AlertRecord, String> {
    Page<AlertRecord> findAll(Pageable pageable);
    Page<AlertRecord> findByComponentIgnoreCase(String component, Pageable pageable);
    Page<AlertRecord> findByAcknowledged(boolean acknowledged, Pageable pageable);
    Page<AlertRecord> findByComponentIgnoreCaseAndAcknowledged(String component, boolean acknowledged, Pageable pageable);
}
