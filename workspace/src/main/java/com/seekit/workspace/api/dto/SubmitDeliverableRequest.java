package com.seekit.workspace.api.dto;

/**
 * Request body for POST /milestones/{id}/submissions.
 *
 * filePath is optional (path or URL of the artefact); description is required.
 */
public record SubmitDeliverableRequest(Long freelancerId, String filePath, String description) {}
