package com.seekit.workspace.service;

import com.seekit.workspace.config.WorkspaceProperties;
import com.seekit.workspace.model.*;
import com.seekit.workspace.repository.MilestoneRepository;
import com.seekit.workspace.repository.ProjectRepository;
import com.seekit.workspace.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Core business logic for the project workspace lifecycle.
 *
 * job accepted → workspace created → milestones submitted / approved / revised
 * → progress recomputed → project completed.
 *
 * Every public method that writes is @Transactional: a failure anywhere in it
 * rolls back the project, milestone, submission and activity rows together.
 * Callers are expected to have validated the upstream application; this class
 * only checks what it needs to keep its own invariants.
 */
@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private final ProjectRepository    projectRepo;
    private final MilestoneRepository  milestoneRepo;
    private final SubmissionRepository submissionRepo;
    private final ActivityLogService   activityLog;
    private final WorkspaceProperties  properties;

    public WorkspaceService(ProjectRepository projectRepo,
                            MilestoneRepository milestoneRepo,
                            SubmissionRepository submissionRepo,
                            ActivityLogService activityLog,
                            WorkspaceProperties properties) {
        this.projectRepo    = projectRepo;
        this.milestoneRepo  = milestoneRepo;
        this.submissionRepo = submissionRepo;
        this.activityLog    = activityLog;
        this.properties     = properties;
    }

    // ------------------------------------------------------------------
    // Workspace creation
    // ------------------------------------------------------------------

    /**
     * Create the workspace for an accepted application using the configured
     * default milestone plan.
     */
    @Transactional
    public Project createWorkspace(Long applicationId, Long jobId, Long freelancerId, Long clientId) {
        return createWorkspace(applicationId, jobId, freelancerId, clientId, null);
    }

    /**
     * Create the workspace for an accepted application.
     *
     * Steps:
     *  1. Save a Project row (status = ACTIVE, progress = 0)
     *  2. Save one PENDING milestone per template, numbered 1..n in list order
     *  3. Log workspace_created on behalf of the freelancer
     *
     * @param milestones ordered milestone plan; null or empty means the configured default
     */
    @Transactional
    public Project createWorkspace(Long applicationId, Long jobId, Long freelancerId, Long clientId,
                                   List<MilestoneTemplate> milestones) {
        List<MilestoneTemplate> plan = (milestones == null || milestones.isEmpty())
                ? properties.defaultMilestones()
                : milestones;

        Project project = projectRepo.save(new Project(applicationId, jobId, freelancerId, clientId));

        List<Milestone> created = new ArrayList<>(plan.size());
        int order = 1;
        for (MilestoneTemplate template : plan) {
            Milestone milestone = new Milestone(project, template.name(), template.description(), order++);
            milestone.setDueDate(template.dueDate());
            created.add(milestone);
        }
        milestoneRepo.saveAll(created);

        activityLog.log(project.getId(), freelancerId, ActivityType.WORKSPACE_CREATED,
                "Workspace created for application #" + applicationId);

        log.info("Workspace {} created for application {} (job={}, freelancer={}, client={}, milestones={})",
                project.getId(), applicationId, jobId, freelancerId, clientId, created.size());
        return project;
    }

    // ------------------------------------------------------------------
    // Deliverables
    // ------------------------------------------------------------------

    /**
     * Record a new deliverable version for a milestone.
     *
     * The version number is 1 + the highest existing version (first submission is v1).
     * The milestone moves to SUBMITTED unless it is already APPROVED, in which case the
     * submission is kept for the record but the status does not change.
     *
     * @throws IllegalArgumentException   if description is blank
     * @throws WorkspaceNotFoundException if the milestone does not exist
     */
    @Transactional
    public Submission submitDeliverable(Long milestoneId, Long freelancerId, String filePath, String description) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Deliverable description is required");
        }
        Milestone milestone = lockMilestone(milestoneId);

        int nextVersion = submissionRepo.findMaxVersionNumber(milestoneId) + 1;
        Submission submission = submissionRepo.save(
                new Submission(milestone, description, filePath, nextVersion));

        if (milestone.isApproved()) {
            log.warn("Milestone {} is already APPROVED; v{} recorded without reopening it",
                    milestoneId, nextVersion);
        } else {
            milestone.setStatus(MilestoneStatus.SUBMITTED);
            milestoneRepo.save(milestone);
        }

        Long projectId = milestone.getProject().getId();
        activityLog.log(projectId, freelancerId, ActivityType.DELIVERABLE_SUBMITTED,
                "Deliverable v" + nextVersion + " submitted for milestone #" + milestoneId);

        log.info("Milestone {} (project={}) received deliverable v{}", milestoneId, projectId, nextVersion);
        return submission;
    }

    // ------------------------------------------------------------------
    // Client review
    // ------------------------------------------------------------------

    /**
     * Approve a milestone and recompute project progress.
     *
     * Approving an already-approved milestone is not rejected: progress is
     * recomputed and a second milestone_approved entry is written.
     *
     * @param feedback optional; attached to the latest submission when non-blank
     * @throws WorkspaceNotFoundException if the milestone does not exist
     */
    @Transactional
    public boolean approveMilestone(Long milestoneId, Long clientId, String feedback) {
        Milestone milestone = lockMilestone(milestoneId);
        if (milestone.isApproved()) {
            log.warn("Milestone {} approved again by client {}", milestoneId, clientId);
        }

        milestone.setStatus(MilestoneStatus.APPROVED);
        milestoneRepo.save(milestone);

        if (feedback != null && !feedback.isBlank()) {
            attachFeedback(milestoneId, feedback);
        }

        Long projectId = milestone.getProject().getId();
        int progress = updateProgress(projectId);

        activityLog.log(projectId, clientId, ActivityType.MILESTONE_APPROVED,
                "Milestone #" + milestoneId + " approved");

        log.info("Milestone {} APPROVED (project={}, progress={}%)", milestoneId, projectId, progress);
        return true;
    }

    /**
     * Send a milestone back to the freelancer. Progress is unaffected.
     *
     * @throws IllegalStateException      if the milestone is already APPROVED
     * @throws WorkspaceNotFoundException if the milestone does not exist
     */
    @Transactional
    public void requestRevision(Long milestoneId, Long clientId, String feedback) {
        Milestone milestone = lockMilestone(milestoneId);
        if (milestone.isApproved()) {
            log.warn("Revision on approved milestone {} refused (client={})", milestoneId, clientId);
            throw new IllegalStateException(
                    "Milestone " + milestoneId + " is APPROVED; revisions can no longer be requested");
        }
        milestone.setStatus(MilestoneStatus.REVISION_REQUESTED);
        milestoneRepo.save(milestone);

        attachFeedback(milestoneId, feedback);

        Long projectId = milestone.getProject().getId();
        activityLog.log(projectId, clientId, ActivityType.REVISION_REQUESTED,
                "Revision requested for milestone #" + milestoneId);

        log.info("Milestone {} REVISION_REQUESTED (project={})", milestoneId, projectId);
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    /**
     * Recompute progress as floor(approved * 100 / total), or 0 for a project
     * without milestones, and store it.
     *
     * At 100% an ACTIVE project becomes COMPLETED. completedAt is stamped the first
     * time that happens and left alone afterwards. A CANCELLED or DISPUTED project
     * keeps its status; only the percentage is written.
     *
     * @return the new progress percentage
     * @throws WorkspaceNotFoundException if the project does not exist
     */
    @Transactional
    public int updateProgress(Long projectId) {
        Project project = projectRepo.findById(projectId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Project", projectId));

        List<Milestone> milestones = milestoneRepo.findByProjectIdOrderByOrderNumberAsc(projectId);
        long approved = milestones.stream().filter(Milestone::isApproved).count();
        int progress = milestones.isEmpty() ? 0 : (int) (approved * 100 / milestones.size());

        project.setProgressPercentage(progress);
        if (progress == 100 && project.getStatus() == ProjectStatus.ACTIVE) {
            project.setStatus(ProjectStatus.COMPLETED);
            if (project.getCompletedAt() == null) {
                project.setCompletedAt(Instant.now());
            }
            log.info("Project {} COMPLETED", projectId);
        }
        projectRepo.save(project);
        return progress;
    }

    // ------------------------------------------------------------------
    // Project-level overrides
    // ------------------------------------------------------------------

    /**
     * Flag a project as disputed, whatever its current status. Progress is kept as is.
     *
     * @throws WorkspaceNotFoundException if the project does not exist
     */
    @Transactional
    public void markDisputed(Long projectId, Long userId, String reason) {
        Project project = projectRepo.findById(projectId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Project", projectId));
        ProjectStatus previous = project.getStatus();
        project.setStatus(ProjectStatus.DISPUTED);
        projectRepo.save(project);

        activityLog.log(projectId, userId, ActivityType.PROJECT_DISPUTED,
                "Project marked as disputed: " + reason);

        log.warn("Project {} {} → DISPUTED by user {}: {}", projectId, previous, userId, reason);
    }

    /**
     * Cancel an active project.
     *
     * @throws IllegalStateException      if the project is not ACTIVE
     * @throws WorkspaceNotFoundException if the project does not exist
     */
    @Transactional
    public void cancelProject(Long projectId, Long userId, String reason) {
        Project project = projectRepo.findById(projectId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Project", projectId));
        if (project.getStatus() != ProjectStatus.ACTIVE) {
            throw new IllegalStateException(
                    "Project " + projectId + " cannot be cancelled from status " + project.getStatus());
        }
        project.setStatus(ProjectStatus.CANCELLED);
        projectRepo.save(project);

        String description = (reason == null || reason.isBlank())
                ? "Project cancelled"
                : "Project cancelled: " + reason;
        activityLog.log(projectId, userId, ActivityType.PROJECT_CANCELLED, description);

        log.info("Project {} CANCELLED by user {}", projectId, userId);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** A project with its milestones in order, or empty if the project does not exist. */
    @Transactional(readOnly = true)
    public Optional<WorkspaceView> getWorkspace(Long projectId) {
        return projectRepo.findById(projectId)
                .map(p -> new WorkspaceView(p, milestoneRepo.findByProjectIdOrderByOrderNumberAsc(projectId)));
    }

    /** ACTIVE workspaces of a freelancer, newest first. */
    @Transactional(readOnly = true)
    public List<Project> getFreelancerWorkspaces(Long freelancerId) {
        return projectRepo.findByFreelancerIdAndStatusOrderByCreatedAtDesc(freelancerId, ProjectStatus.ACTIVE);
    }

    /** All workspaces of a client regardless of status, newest first. */
    @Transactional(readOnly = true)
    public List<Project> getClientWorkspaces(Long clientId) {
        return projectRepo.findByClientIdOrderByCreatedAtDesc(clientId);
    }

    @Transactional(readOnly = true)
    public Optional<Milestone> findMilestone(Long milestoneId) {
        return milestoneRepo.findById(milestoneId);
    }

    /** Submission history of a milestone, highest version first. */
    @Transactional(readOnly = true)
    public List<Submission> getMilestoneSubmissions(Long milestoneId) {
        return submissionRepo.findByMilestoneIdOrderByVersionNumberDesc(milestoneId);
    }

    /** Activity trail of a project, newest first. */
    @Transactional(readOnly = true)
    public List<ActivityLogEntry> getActivityLog(Long projectId) {
        return activityLog.history(projectId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Milestone lockMilestone(Long milestoneId) {
        return milestoneRepo.findByIdForUpdate(milestoneId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Milestone", milestoneId));
    }

    /** Write feedback onto the current (highest-version) submission, if there is one. */
    private void attachFeedback(Long milestoneId, String feedback) {
        submissionRepo.findFirstByMilestoneIdOrderByVersionNumberDesc(milestoneId)
                .ifPresentOrElse(
                        latest -> {
                            latest.setClientFeedback(feedback);
                            submissionRepo.save(latest);
                        },
                        () -> log.warn("Milestone {} has no submission to attach feedback to", milestoneId));
    }
}
