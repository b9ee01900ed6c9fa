package com.seekit.workspace.api.dto;

import com.seekit.workspace.model.Milestone;
import com.seekit.workspace.model.MilestoneStatus;

import java.time.LocalDate;

public record MilestoneResponse(
        Long            id,
        int             orderNumber,
        String          name,
        String          description,
        MilestoneStatus status,
        LocalDate       dueDate
) {
    public static MilestoneResponse from(Milestone m) {
        return new MilestoneResponse(
                m.getId(),
                m.getOrderNumber(),
                m.getName(),
                m.getDescription(),
                m.getStatus(),
                m.getDueDate()
        );
    }
}
