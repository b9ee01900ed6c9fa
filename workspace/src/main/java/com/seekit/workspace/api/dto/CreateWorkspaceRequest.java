package com.seekit.workspace.api.dto;

import com.seekit.workspace.model.MilestoneTemplate;

import java.util.List;

/**
 * Request body for POST /workspaces, sent by the application-management
 * component once it has accepted an application.
 *
 * Required: applicationId, jobId, freelancerId, clientId
 * Optional: milestones, the ordered plan; omitted or empty means the configured default.
 */
public record CreateWorkspaceRequest(Long applicationId, Long jobId, Long freelancerId, Long clientId,
                                     List<MilestoneTemplate> milestones) {}
