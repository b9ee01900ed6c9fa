package com.seekit.workspace.api.dto;

/**
 * Request body for POST /workspaces/{id}/dispute and /workspaces/{id}/cancel.
 */
public record ProjectActionRequest(Long userId, String reason) {}
