package com.seekit.workspace.service;

import com.seekit.workspace.model.Project;
import com.seekit.workspace.model.Review;

import java.util.List;

/**
 * A freelancer's track record: completed projects and the reviews received for them.
 */
public record Portfolio(
        Long          freelancerId,
        List<Project> completedProjects,
        List<Review>  reviews,
        Stats         stats
) {
    /**
     * @param averageRating mean rating over all reviews; null when there are none
     */
    public record Stats(int totalProjects, Double averageRating, int totalReviews) {}
}
