package com.seekit.workspace.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One line of a project's audit trail.
 *
 * Insert-only: every column is updatable = false and the class has no setters.
 * ActivityLogRepository only exposes save and read methods.
 *
 * DB table: activity_log  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "activity_log")
public class ActivityLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "log_id")
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private Long projectId;

    // The user who caused the change (freelancer or client).
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    // See ActivityType for the tags this service writes.
    @Column(name = "activity_type", nullable = false, updatable = false, length = 50)
    private String activityType;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ActivityLogEntry() {}   // required by JPA

    public ActivityLogEntry(Long projectId, Long userId, String activityType, String description) {
        this.projectId    = projectId;
        this.userId       = userId;
        this.activityType = activityType;
        this.description  = description;
    }

    public Long    getId()           { return id; }
    public Long    getProjectId()    { return projectId; }
    public Long    getUserId()       { return userId; }
    public String  getActivityType() { return activityType; }
    public String  getDescription()  { return description; }
    public Instant getCreatedAt()    { return createdAt; }
}
