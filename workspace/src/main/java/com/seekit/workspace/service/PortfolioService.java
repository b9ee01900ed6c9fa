package com.seekit.workspace.service;

import com.seekit.workspace.model.ActivityType;
import com.seekit.workspace.model.Project;
import com.seekit.workspace.model.ProjectStatus;
import com.seekit.workspace.model.Review;
import com.seekit.workspace.repository.ProjectRepository;
import com.seekit.workspace.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reviews on completed projects and the freelancer portfolio built from them.
 */
@Service
public class PortfolioService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioService.class);

    private static final int MIN_RATING = 1;
    private static final int MAX_RATING = 5;

    private final ProjectRepository  projectRepo;
    private final ReviewRepository   reviewRepo;
    private final ActivityLogService activityLog;

    public PortfolioService(ProjectRepository projectRepo,
                            ReviewRepository reviewRepo,
                            ActivityLogService activityLog) {
        this.projectRepo = projectRepo;
        this.reviewRepo  = reviewRepo;
        this.activityLog = activityLog;
    }

    /**
     * Leave a review for the other side of a completed project.
     *
     * The reviewee is derived: a client reviews the freelancer and vice versa.
     *
     * @throws WorkspaceNotFoundException if the project does not exist
     * @throws IllegalArgumentException   if the reviewer is not on the project or the rating is out of range
     * @throws IllegalStateException      if the project is not COMPLETED or the reviewer already reviewed it
     */
    @Transactional
    public Review leaveReview(Long projectId, Long reviewerId, int rating, String comment) {
        Project project = projectRepo.findById(projectId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Project", projectId));

        if (!project.isParticipant(reviewerId)) {
            throw new IllegalArgumentException(
                    "User " + reviewerId + " is not a participant of project " + projectId);
        }
        if (rating < MIN_RATING || rating > MAX_RATING) {
            throw new IllegalArgumentException(
                    "Rating must be between " + MIN_RATING + " and " + MAX_RATING + ", got " + rating);
        }
        if (project.getStatus() != ProjectStatus.COMPLETED) {
            throw new IllegalStateException(
                    "Project " + projectId + " is " + project.getStatus() + "; only completed projects can be reviewed");
        }
        if (reviewRepo.existsByProjectIdAndReviewerId(projectId, reviewerId)) {
            throw new IllegalStateException(
                    "User " + reviewerId + " has already reviewed project " + projectId);
        }

        Long revieweeId = reviewerId.equals(project.getClientId())
                ? project.getFreelancerId()
                : project.getClientId();
        Review review = reviewRepo.save(new Review(projectId, reviewerId, revieweeId, rating, comment));

        activityLog.log(projectId, reviewerId, ActivityType.REVIEW_LEFT,
                "Review left for user #" + revieweeId + " (" + rating + "/5)");

        log.info("Project {}: user {} rated user {} {}/5", projectId, reviewerId, revieweeId, rating);
        return review;
    }

    /**
     * Completed projects of a freelancer plus the reviews they received.
     * A freelancer with no history gets an empty portfolio, not an error.
     *
     * The review list holds everything received. Stats only count reviews on
     * projects that are still COMPLETED, so a project moved to DISPUTED drops
     * out of totalProjects and the rating figures together.
     */
    @Transactional(readOnly = true)
    public Portfolio getPortfolio(Long freelancerId) {
        List<Project> completed = projectRepo
                .findByFreelancerIdAndStatusOrderByCompletedAtDesc(freelancerId, ProjectStatus.COMPLETED);
        List<Review> reviews = reviewRepo.findByRevieweeIdOrderByCreatedAtDesc(freelancerId);

        Set<Long> completedIds = completed.stream().map(Project::getId).collect(Collectors.toSet());
        List<Review> counted = reviews.stream()
                .filter(r -> completedIds.contains(r.getProjectId()))
                .toList();

        Double average = counted.isEmpty()
                ? null
                : counted.stream().mapToInt(Review::getRating).average().orElse(0);

        return new Portfolio(freelancerId, completed, reviews,
                new Portfolio.Stats(completed.size(), average, counted.size()));
    }
}
