package com.seekit.workspace.api.dto;

import com.seekit.workspace.model.Project;
import com.seekit.workspace.model.ProjectStatus;

import java.time.Instant;

/**
 * Summary of a workspace, used in lists and as the header of WorkspaceResponse.
 */
public record ProjectResponse(
        Long          id,
        Long          applicationId,
        Long          jobId,
        Long          freelancerId,
        Long          clientId,
        ProjectStatus status,
        int           progressPercentage,
        Instant       createdAt,
        Instant       completedAt
) {
    public static ProjectResponse from(Project p) {
        return new ProjectResponse(
                p.getId(),
                p.getApplicationId(),
                p.getJobId(),
                p.getFreelancerId(),
                p.getClientId(),
                p.getStatus(),
                p.getProgressPercentage(),
                p.getCreatedAt(),
                p.getCompletedAt()
        );
    }
}
