package org.caureq.selfrepair.repo;

import org.caureq.selfrepair.domain.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScheduledJobRepo extends JpaRepository<ScheduledJob, String> {
}
