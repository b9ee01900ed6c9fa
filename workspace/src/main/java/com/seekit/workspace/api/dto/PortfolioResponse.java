package com.seekit.workspace.api.dto;

import com.seekit.workspace.service.Portfolio;

import java.util.List;

/**
 * Response body for GET /freelancers/{id}/portfolio.
 */
public record PortfolioResponse(
        Long                  freelancerId,
        int                   totalProjects,
        Double                averageRating,
        int                   totalReviews,
        List<ProjectResponse> projects,
        List<ReviewResponse>  reviews
) {
    public static PortfolioResponse from(Portfolio p) {
        return new PortfolioResponse(
                p.freelancerId(),
                p.stats().totalProjects(),
                p.stats().averageRating(),
                p.stats().totalReviews(),
                p.completedProjects().stream().map(ProjectResponse::from).toList(),
                p.reviews().stream().map(ReviewResponse::from).toList()
        );
    }
}
