package com.seekit.workspace.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * The workspace spawned when a client accepts a freelancer's application.
 *
 * Milestones point back here and are loaded through MilestoneRepository.
 * The progress percentage is derived from how many of them are APPROVED and
 * is only ever written by WorkspaceService.updateProgress().
 *
 * DB table: projects  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "projects")
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    // One workspace per accepted application (unique constraint in V1).
    @Column(name = "application_id", nullable = false, updatable = false)
    private Long applicationId;

    @Column(name = "freelancer_id", nullable = false)
    private Long freelancerId;

    @Column(name = "client_id", nullable = false)
    private Long clientId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProjectStatus status = ProjectStatus.ACTIVE;

    @Column(name = "progress_percentage", nullable = false)
    private int progressPercentage = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // Stamped the first time progress reaches 100%.
    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Project() {}   // required by JPA

    public Project(Long applicationId, Long jobId, Long freelancerId, Long clientId) {
        this.applicationId = applicationId;
        this.jobId         = jobId;
        this.freelancerId  = freelancerId;
        this.clientId      = clientId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long          getId()                 { return id; }
    public Long          getJobId()              { return jobId; }
    public Long          getApplicationId()      { return applicationId; }
    public Long          getFreelancerId()       { return freelancerId; }
    public Long          getClientId()           { return clientId; }
    public ProjectStatus getStatus()             { return status; }
    public int           getProgressPercentage() { return progressPercentage; }
    public Instant       getCreatedAt()          { return createdAt; }
    public Instant       getCompletedAt()        { return completedAt; }

    public void setStatus(ProjectStatus status)          { this.status = status; }
    public void setProgressPercentage(int progress)      { this.progressPercentage = progress; }
    public void setCompletedAt(Instant completedAt)      { this.completedAt = completedAt; }

    /** True if the user is either side of this engagement. */
    public boolean isParticipant(Long userId) {
        return freelancerId.equals(userId) || clientId.equals(userId);
    }
}
