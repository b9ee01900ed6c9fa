package com.seekit.workspace.api.dto;

import com.seekit.workspace.model.Submission;

import java.time.Instant;

public record SubmissionResponse(
        Long    id,
        int     versionNumber,
        String  deliverableDescription,
        String  filePath,
        Instant submittedAt,
        String  clientFeedback
) {
    public static SubmissionResponse from(Submission s) {
        return new SubmissionResponse(
                s.getId(),
                s.getVersionNumber(),
                s.getDeliverableDescription(),
                s.getFilePath(),
                s.getSubmittedAt(),
                s.getClientFeedback()
        );
    }
}
