package com.seekit.workspace.model;

/**
 * Review state of a single milestone.
 *
 * Transitions:
 *   PENDING            → SUBMITTED          (first deliverable submitted)
 *   SUBMITTED          → APPROVED           (client accepts)
 *   SUBMITTED          → REVISION_REQUESTED (client sends it back)
 *   REVISION_REQUESTED → SUBMITTED          (freelancer resubmits)
 *
 * APPROVED is terminal: later submissions are recorded but the status stays put.
 */
public enum MilestoneStatus {
    PENDING,
    SUBMITTED,
    REVISION_REQUESTED,
    APPROVED
}
