package org.caureq.selfrepair.repo;

import jakarta.persistence.LockModeType;
import org.caureq.selfrepair.domain.ComponentHealth;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ComponentHealthRepo extends JpaRepository<ComponentHealth, Long> {
    Optional<ComponentHealth> findByComponentName(String componentName);
    List<ComponentHealth> findAllByOrderByComponentNameAsc();

    /** Row lock held until the surrounding transaction ends: one writer per component row. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select h from ComponentHealth h where h.componentName = :name")
    Optional<ComponentHealth> findForUpdate(@Param("name") String componentName);
}
