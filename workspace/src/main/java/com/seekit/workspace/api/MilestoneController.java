package com.seekit.workspace.api;

import com.seekit.workspace.api.dto.ReviewDecisionRequest;
import com.seekit.workspace.api.dto.SubmissionResponse;
import com.seekit.workspace.api.dto.SubmitDeliverableRequest;
import com.seekit.workspace.model.Submission;
import com.seekit.workspace.service.WorkspaceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for milestone deliverables and client decisions.
 *
 * POST /milestones/{id}/submissions : freelancer submits a new deliverable version
 * GET  /milestones/{id}/submissions : version history, newest first
 * POST /milestones/{id}/approve     : client approves (feedback optional)
 * POST /milestones/{id}/revision    : client requests changes (feedback required)
 */
@RestController
@RequestMapping("/milestones")
public class MilestoneController {

    private final WorkspaceService workspaceService;

    public MilestoneController(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    @PostMapping("/{id}/submissions")
    public ResponseEntity<SubmissionResponse> submit(@PathVariable Long id,
                                                     @RequestBody SubmitDeliverableRequest req) {
        requireActor(req.freelancerId(), "freelancerId");
        Submission submission = workspaceService.submitDeliverable(
                id, req.freelancerId(), req.filePath(), req.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmissionResponse.from(submission));
    }

    /**
     * Returns 404 if the milestone ID is not found.
     */
    @GetMapping("/{id}/submissions")
    public List<SubmissionResponse> getSubmissions(@PathVariable Long id) {
        workspaceService.findMilestone(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Milestone not found: " + id));
        return workspaceService.getMilestoneSubmissions(id).stream()
                .map(SubmissionResponse::from)
                .toList();
    }

    @PostMapping("/{id}/approve")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void approve(@PathVariable Long id, @RequestBody ReviewDecisionRequest req) {
        requireActor(req.clientId(), "clientId");
        workspaceService.approveMilestone(id, req.clientId(), req.feedback());
    }

    /**
     * The engine accepts any feedback string; the "must explain what to change"
     * rule lives here.
     */
    @PostMapping("/{id}/revision")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void requestRevision(@PathVariable Long id, @RequestBody ReviewDecisionRequest req) {
        requireActor(req.clientId(), "clientId");
        if (req.feedback() == null || req.feedback().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Feedback is required to request a revision");
        }
        workspaceService.requestRevision(id, req.clientId(), req.feedback());
    }

    private static void requireActor(Long userId, String field) {
        if (userId == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
        }
    }
}
