package com.seekit.workspace.api.dto;

import com.seekit.workspace.service.WorkspaceView;

import java.util.List;

/**
 * Response body for GET /workspaces/{id}: the project plus its milestones in order.
 */
public record WorkspaceResponse(ProjectResponse project, List<MilestoneResponse> milestones) {

    public static WorkspaceResponse from(WorkspaceView view) {
        return new WorkspaceResponse(
                ProjectResponse.from(view.project()),
                view.milestones().stream().map(MilestoneResponse::from).toList()
        );
    }
}
