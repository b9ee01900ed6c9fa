package com.seekit.workspace.model;

/**
 * Lifecycle state of a project workspace.
 *
 * Transitions:
 *   ACTIVE    → COMPLETED (only when progress reaches 100%)
 *   ACTIVE    → CANCELLED
 *   any state → DISPUTED
 *
 * The only way out of COMPLETED or CANCELLED is into DISPUTED.
 * DISPUTED has no exit here; resolution happens outside this service.
 */
public enum ProjectStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED,
    DISPUTED
}
