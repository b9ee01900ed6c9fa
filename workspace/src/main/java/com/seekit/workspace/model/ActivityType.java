package com.seekit.workspace.model;

/**
 * Tags written to activity_log.activity_type.
 *
 * The column is free-form text, so these are plain strings rather than an enum:
 * rows written by older clients with other tags must still load.
 */
public final class ActivityType {

    public static final String WORKSPACE_CREATED     = "workspace_created";
    public static final String DELIVERABLE_SUBMITTED = "deliverable_submitted";
    public static final String MILESTONE_APPROVED    = "milestone_approved";
    public static final String REVISION_REQUESTED    = "revision_requested";
    public static final String PROJECT_DISPUTED      = "project_disputed";
    public static final String PROJECT_CANCELLED     = "project_cancelled";
    public static final String REVIEW_LEFT           = "review_left";

    private ActivityType() {}
}
