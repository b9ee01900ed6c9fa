package com.seekit.workspace.repository;

import com.seekit.workspace.model.Submission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + version queries for the submissions table.
 */
public interface SubmissionRepository extends JpaRepository<Submission, Long> {

    /** Highest version recorded for a milestone, or 0 when nothing has been submitted yet. */
    @Query("""
            SELECT COALESCE(MAX(s.versionNumber), 0) FROM Submission s
            WHERE s.milestone.id = :milestoneId
            """)
    int findMaxVersionNumber(@Param("milestoneId") Long milestoneId);

    /** The current deliverable: the submission with the highest version. */
    Optional<Submission> findFirstByMilestoneIdOrderByVersionNumberDesc(Long milestoneId);

    /** Version history, newest first. */
    List<Submission> findByMilestoneIdOrderByVersionNumberDesc(Long milestoneId);
}
