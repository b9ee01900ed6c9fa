package com.seekit.workspace.api;

import com.seekit.workspace.api.dto.*;
import com.seekit.workspace.model.Project;
import com.seekit.workspace.service.PortfolioService;
import com.seekit.workspace.service.WorkspaceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for project workspaces.
 *
 * POST /workspaces                  : create the workspace for an accepted application
 * GET  /workspaces/{id}             : project with its milestones
 * GET  /workspaces?freelancerId=..  : active workspaces of a freelancer
 * GET  /workspaces?clientId=..      : all workspaces of a client
 * GET  /workspaces/{id}/activity    : activity trail, newest first
 * POST /workspaces/{id}/dispute     : flag the project as disputed
 * POST /workspaces/{id}/cancel      : cancel an active project
 * POST /workspaces/{id}/reviews     : review the counterpart of a completed project
 */
@RestController
@RequestMapping("/workspaces")
public class WorkspaceController {

    private final WorkspaceService workspaceService;
    private final PortfolioService portfolioService;

    public WorkspaceController(WorkspaceService workspaceService, PortfolioService portfolioService) {
        this.workspaceService = workspaceService;
        this.portfolioService = portfolioService;
    }

    /**
     * Create a workspace.
     *
     * Example:
     *   curl -X POST http://localhost:8080/workspaces \
     *     -H "Content-Type: application/json" \
     *     -d '{"applicationId":10,"jobId":5,"freelancerId":3,"clientId":7}'
     */
    @PostMapping
    public ResponseEntity<ProjectResponse> create(@RequestBody CreateWorkspaceRequest req) {
        if (req.applicationId() == null || req.jobId() == null
                || req.freelancerId() == null || req.clientId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "applicationId, jobId, freelancerId and clientId are required");
        }
        Project project = workspaceService.createWorkspace(
                req.applicationId(), req.jobId(), req.freelancerId(), req.clientId(), req.milestones());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
    }

    /**
     * Returns 404 if the project ID is not found.
     */
    @GetMapping("/{id}")
    public WorkspaceResponse getWorkspace(@PathVariable Long id) {
        return workspaceService.getWorkspace(id)
                .map(WorkspaceResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    /**
     * Exactly one of freelancerId / clientId must be given.
     */
    @GetMapping
    public List<ProjectResponse> list(@RequestParam(required = false) Long freelancerId,
                                      @RequestParam(required = false) Long clientId) {
        List<Project> projects;
        if (freelancerId != null && clientId == null) {
            projects = workspaceService.getFreelancerWorkspaces(freelancerId);
        } else if (clientId != null && freelancerId == null) {
            projects = workspaceService.getClientWorkspaces(clientId);
        } else {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Specify exactly one of freelancerId or clientId");
        }
        return projects.stream().map(ProjectResponse::from).toList();
    }

    @GetMapping("/{id}/activity")
    public List<ActivityResponse> getActivity(@PathVariable Long id) {
        workspaceService.getWorkspace(id).orElseThrow(() -> notFound(id));
        return workspaceService.getActivityLog(id).stream()
                .map(ActivityResponse::from)
                .toList();
    }

    @PostMapping("/{id}/dispute")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void dispute(@PathVariable Long id, @RequestBody ProjectActionRequest req) {
        requireActor(req.userId(), "userId");
        workspaceService.markDisputed(id, req.userId(), req.reason());
    }

    /**
     * HTTP 409 if the project is no longer ACTIVE.
     */
    @PostMapping("/{id}/cancel")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void cancel(@PathVariable Long id, @RequestBody ProjectActionRequest req) {
        requireActor(req.userId(), "userId");
        workspaceService.cancelProject(id, req.userId(), req.reason());
    }

    @PostMapping("/{id}/reviews")
    public ResponseEntity<ReviewResponse> leaveReview(@PathVariable Long id, @RequestBody LeaveReviewRequest req) {
        requireActor(req.reviewerId(), "reviewerId");
        var review = portfolioService.leaveReview(id, req.reviewerId(), req.rating(), req.comment());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReviewResponse.from(review));
    }

    private static void requireActor(Long userId, String field) {
        if (userId == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
        }
    }

    private static ResponseStatusException notFound(Long id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Workspace not found: " + id);
    }
}
