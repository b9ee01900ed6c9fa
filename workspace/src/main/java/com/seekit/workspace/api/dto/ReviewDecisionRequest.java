package com.seekit.workspace.api.dto;

/**
 * Request body for POST /milestones/{id}/approve and /milestones/{id}/revision.
 *
 * feedback is optional on approve and required on revision.
 */
public record ReviewDecisionRequest(Long clientId, String feedback) {}
