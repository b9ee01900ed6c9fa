package com.seekit.workspace.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A rating one participant leaves for the other after a project completes.
 *
 * Reviews received by a freelancer make up the social half of their portfolio.
 *
 * DB table: reviews  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "reviews")
public class Review {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private Long projectId;

    @Column(name = "reviewer_id", nullable = false, updatable = false)
    private Long reviewerId;

    @Column(name = "reviewee_id", nullable = false, updatable = false)
    private Long revieweeId;

    // 1..5, checked by PortfolioService and by a CHECK constraint.
    @Column(nullable = false, updatable = false)
    private int rating;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String comment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Review() {}   // required by JPA

    public Review(Long projectId, Long reviewerId, Long revieweeId, int rating, String comment) {
        this.projectId  = projectId;
        this.reviewerId = reviewerId;
        this.revieweeId = revieweeId;
        this.rating     = rating;
        this.comment    = comment;
    }

    public Long    getId()         { return id; }
    public Long    getProjectId()  { return projectId; }
    public Long    getReviewerId() { return reviewerId; }
    public Long    getRevieweeId() { return revieweeId; }
    public int     getRating()     { return rating; }
    public String  getComment()    { return comment; }
    public Instant getCreatedAt()  { return createdAt; }
}
