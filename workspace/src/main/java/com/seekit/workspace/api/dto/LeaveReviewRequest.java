package com.seekit.workspace.api.dto;

/**
 * Request body for POST /workspaces/{id}/reviews. rating is 1..5.
 */
public record LeaveReviewRequest(Long reviewerId, int rating, String comment) {}
