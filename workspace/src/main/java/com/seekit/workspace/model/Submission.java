package com.seekit.workspace.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One version of a deliverable submitted against a milestone.
 *
 * Version numbers start at 1 and grow by one per milestone; the highest
 * version is the "current" deliverable. Everything except clientFeedback
 * is fixed at insert time.
 *
 * DB table: submissions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "submissions")
public class Submission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "milestone_id", nullable = false, updatable = false)
    private Milestone milestone;

    @Column(name = "deliverable_description", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String deliverableDescription;

    // Path or URL to the uploaded artefact; optional.
    @Column(name = "file_path", updatable = false, columnDefinition = "TEXT")
    private String filePath;

    @Column(name = "version_number", nullable = false, updatable = false)
    private int versionNumber;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt = Instant.now();

    @Column(name = "client_feedback", columnDefinition = "TEXT")
    private String clientFeedback;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Submission() {}   // required by JPA

    public Submission(Milestone milestone, String deliverableDescription, String filePath, int versionNumber) {
        this.milestone              = milestone;
        this.deliverableDescription = deliverableDescription;
        this.filePath               = filePath;
        this.versionNumber          = versionNumber;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long      getId()                     { return id; }
    public Milestone getMilestone()              { return milestone; }
    public String    getDeliverableDescription() { return deliverableDescription; }
    public String    getFilePath()               { return filePath; }
    public int       getVersionNumber()          { return versionNumber; }
    public Instant   getSubmittedAt()            { return submittedAt; }
    public String    getClientFeedback()         { return clientFeedback; }

    public void setClientFeedback(String clientFeedback) { this.clientFeedback = clientFeedback; }
}
