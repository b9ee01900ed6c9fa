package com.seekit.workspace.repository;

import com.seekit.workspace.model.Milestone;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + query operations for the milestones table.
 */
public interface MilestoneRepository extends JpaRepository<Milestone, Long> {

    /** All milestones of a project in delivery order. */
    List<Milestone> findByProjectIdOrderByOrderNumberAsc(Long projectId);

    /**
     * Load a milestone and hold a row lock on it until the transaction ends.
     *
     * Every write to a milestone or its submissions goes through this, so two
     * submissions to the same milestone cannot compute the same next version
     * number. Must be called inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Milestone m WHERE m.id = :id")
    Optional<Milestone> findByIdForUpdate(@Param("id") Long id);
}
