package com.seekit.workspace.api.dto;

import com.seekit.workspace.model.Review;

import java.time.Instant;

public record ReviewResponse(
        Long    id,
        Long    projectId,
        Long    reviewerId,
        Long    revieweeId,
        int     rating,
        String  comment,
        Instant createdAt
) {
    public static ReviewResponse from(Review r) {
        return new ReviewResponse(
                r.getId(),
                r.getProjectId(),
                r.getReviewerId(),
                r.getRevieweeId(),
                r.getRating(),
                r.getComment(),
                r.getCreatedAt()
        );
    }
}
