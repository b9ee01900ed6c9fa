package com.seekit.workspace.repository;

import com.seekit.workspace.model.Project;
import com.seekit.workspace.model.ProjectStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD + query operations for the projects table.
 * Spring Data derives every query below from the method name.
 */
public interface ProjectRepository extends JpaRepository<Project, Long> {

    /** Workspaces a freelancer is working in, filtered by status, newest first. */
    List<Project> findByFreelancerIdAndStatusOrderByCreatedAtDesc(Long freelancerId, ProjectStatus status);

    /** Every workspace a client owns, newest first. */
    List<Project> findByClientIdOrderByCreatedAtDesc(Long clientId);

    /** Completed work for the portfolio, most recently completed first. */
    List<Project> findByFreelancerIdAndStatusOrderByCompletedAtDesc(Long freelancerId, ProjectStatus status);
}
