package com.seekit.workspace.api.dto;

import com.seekit.workspace.model.ActivityLogEntry;

import java.time.Instant;

public record ActivityResponse(
        Long    id,
        Long    userId,
        String  activityType,
        String  description,
        Instant createdAt
) {
    public static ActivityResponse from(ActivityLogEntry e) {
        return new ActivityResponse(
                e.getId(),
                e.getUserId(),
                e.getActivityType(),
                e.getDescription(),
                e.getCreatedAt()
        );
    }
}
