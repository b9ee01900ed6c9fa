package com.seekit.workspace.service;

import com.seekit.workspace.config.WorkspaceProperties;
import com.seekit.workspace.model.*;
import com.seekit.workspace.repository.MilestoneRepository;
import com.seekit.workspace.repository.ProjectRepository;
import com.seekit.workspace.repository.SubmissionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.seekit.workspace.TestEntities.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WorkspaceService.
 *
 * Repositories and the activity log are mocked with Mockito, so there is no Spring
 * context, no database.
 */
@ExtendWith(MockitoExtension.class)
class WorkspaceServiceTest {

    @Mock ProjectRepository    projectRepo;
    @Mock MilestoneRepository  milestoneRepo;
    @Mock SubmissionRepository submissionRepo;
    @Mock ActivityLogService   activityLog;

    WorkspaceService service;

    @BeforeEach
    void setUp() {
        service = new WorkspaceService(projectRepo, milestoneRepo, submissionRepo, activityLog,
                new WorkspaceProperties(null));
    }

    // ------------------------------------------------------------------
    // createWorkspace()
    // ------------------------------------------------------------------

    @Test
    void createWorkspace_defaultPlan_createsFourPendingMilestonesAndLogsCreation() {
        when(projectRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0), 42L));

        Project project = service.createWorkspace(10L, 5L, 3L, 7L);

        assertThat(project.getId()).isEqualTo(42L);
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
        assertThat(project.getProgressPercentage()).isZero();
        assertThat(project.getCompletedAt()).isNull();

        List<Milestone> milestones = capturedMilestones();
        assertThat(milestones)
                .extracting(Milestone::getName)
                .containsExactly("Initial Design", "Development", "Testing", "Final Delivery");
        assertThat(milestones).extracting(Milestone::getOrderNumber).containsExactly(1, 2, 3, 4);
        assertThat(milestones).allSatisfy(m -> {
            assertThat(m.getStatus()).isEqualTo(MilestoneStatus.PENDING);
            assertThat(m.getProject()).isSameAs(project);
        });

        verify(activityLog).log(42L, 3L, ActivityType.WORKSPACE_CREATED, "Workspace created for application #10");
        verifyNoMoreInteractions(activityLog);
    }

    @Test
    void createWorkspace_customPlan_numbersMilestonesInListOrder() {
        when(projectRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0), 42L));
        LocalDate due = LocalDate.of(2026, 11, 30);

        service.createWorkspace(10L, 5L, 3L, 7L, List.of(
                new MilestoneTemplate("Research", "Competitor review", null),
                new MilestoneTemplate("Launch", "Go live", due)));

        List<Milestone> milestones = capturedMilestones();
        assertThat(milestones).extracting(Milestone::getName).containsExactly("Research", "Launch");
        assertThat(milestones).extracting(Milestone::getOrderNumber).containsExactly(1, 2);
        assertThat(milestones.get(1).getDueDate()).isEqualTo(due);
    }

    @Test
    void createWorkspace_emptyPlan_fallsBackToConfiguredDefault() {
        service = new WorkspaceService(projectRepo, milestoneRepo, submissionRepo, activityLog,
                new WorkspaceProperties(List.of(
                        new MilestoneTemplate("Draft", null, null),
                        new MilestoneTemplate("Final", null, null))));
        when(projectRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0), 42L));

        service.createWorkspace(10L, 5L, 3L, 7L, List.of());

        assertThat(capturedMilestones()).extracting(Milestone::getName).containsExactly("Draft", "Final");
    }

    @Test
    void createWorkspace_milestoneSaveFails_propagatesWithoutLogging() {
        when(projectRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0), 42L));
        when(milestoneRepo.saveAll(any())).thenThrow(new IllegalStateException("connection lost"));

        assertThatThrownBy(() -> service.createWorkspace(10L, 5L, 3L, 7L))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("connection lost");
        verifyNoInteractions(activityLog);
    }

    // ------------------------------------------------------------------
    // submitDeliverable()
    // ------------------------------------------------------------------

    @Test
    void submitDeliverable_firstSubmission_isVersionOneAndMarksSubmitted() {
        Milestone milestone = milestone(project(42L), 101L, 1, MilestoneStatus.PENDING);
        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(milestone));
        when(submissionRepo.findMaxVersionNumber(101L)).thenReturn(0);
        when(submissionRepo.save(any())).thenAnswer(inv -> withId(inv.getArgument(0), 500L));

        Submission submission = service.submitDeliverable(101L, 3L, "designs/v1.fig", "Wireframes");

        assertThat(submission.getVersionNumber()).isEqualTo(1);
        assertThat(submission.getFilePath()).isEqualTo("designs/v1.fig");
        assertThat(submission.getDeliverableDescription()).isEqualTo("Wireframes");
        assertThat(submission.getClientFeedback()).isNull();
        assertThat(milestone.getStatus()).isEqualTo(MilestoneStatus.SUBMITTED);
        verify(activityLog).log(42L, 3L, ActivityType.DELIVERABLE_SUBMITTED,
                "Deliverable v1 submitted for milestone #101");
    }

    @Test
    void submitDeliverable_afterRevision_incrementsVersionAndResubmits() {
        Milestone milestone = milestone(project(42L), 101L, 1, MilestoneStatus.REVISION_REQUESTED);
        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(milestone));
        when(submissionRepo.findMaxVersionNumber(101L)).thenReturn(2);
        when(submissionRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Submission submission = service.submitDeliverable(101L, 3L, null, "Fixed colours");

        assertThat(submission.getVersionNumber()).isEqualTo(3);
        assertThat(submission.getFilePath()).isNull();
        assertThat(milestone.getStatus()).isEqualTo(MilestoneStatus.SUBMITTED);
    }

    @Test
    void submitDeliverable_approvedMilestone_recordsSubmissionButStaysApproved() {
        Milestone milestone = milestone(project(42L), 101L, 1, MilestoneStatus.APPROVED);
        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(milestone));
        when(submissionRepo.findMaxVersionNumber(101L)).thenReturn(1);
        when(submissionRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Submission submission = service.submitDeliverable(101L, 3L, null, "One more tweak");

        assertThat(submission.getVersionNumber()).isEqualTo(2);
        assertThat(milestone.getStatus()).isEqualTo(MilestoneStatus.APPROVED);
        verify(milestoneRepo, never()).save(any());
    }

    @Test
    void submitDeliverable_blankDescription_rejectedBeforeTouchingStore() {
        assertThatThrownBy(() -> service.submitDeliverable(101L, 3L, "file.zip", "  "))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(milestoneRepo, submissionRepo, activityLog);
    }

    @Test
    void submitDeliverable_unknownMilestone_throwsNotFound() {
        when(milestoneRepo.findByIdForUpdate(999L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.submitDeliverable(999L, 3L, null, "Wireframes"))
                .isInstanceOf(WorkspaceNotFoundException.class)
                .hasMessageContaining("999");
        verify(submissionRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // approveMilestone()
    // ------------------------------------------------------------------

    @Test
    void approveMilestone_withFeedback_approvesAttachesFeedbackAndUpdatesProgress() {
        Project project = project(42L);
        List<Milestone> milestones = fourMilestones(project);
        Milestone first = milestones.get(0);
        first.setStatus(MilestoneStatus.SUBMITTED);
        Submission latest = new Submission(first, "Wireframes", null, 2);

        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(first));
        when(submissionRepo.findFirstByMilestoneIdOrderByVersionNumberDesc(101L)).thenReturn(Optional.of(latest));
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        boolean result = service.approveMilestone(101L, 7L, "Looks great");

        assertThat(result).isTrue();
        assertThat(first.getStatus()).isEqualTo(MilestoneStatus.APPROVED);
        assertThat(latest.getClientFeedback()).isEqualTo("Looks great");
        assertThat(project.getProgressPercentage()).isEqualTo(25);
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
        verify(submissionRepo).save(latest);
        verify(activityLog).log(42L, 7L, ActivityType.MILESTONE_APPROVED, "Milestone #101 approved");
    }

    @Test
    void approveMilestone_withoutFeedback_leavesSubmissionsAlone() {
        Project project = project(42L);
        List<Milestone> milestones = fourMilestones(project);
        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(milestones.get(0)));
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        service.approveMilestone(101L, 7L, null);

        verifyNoInteractions(submissionRepo);
    }

    @Test
    void approveMilestone_alreadyApproved_recomputesAndLogsAgain() {
        Project project = project(42L);
        List<Milestone> milestones = fourMilestones(project);
        milestones.get(0).setStatus(MilestoneStatus.APPROVED);
        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(milestones.get(0)));
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        service.approveMilestone(101L, 7L, null);
        service.approveMilestone(101L, 7L, null);

        assertThat(project.getProgressPercentage()).isEqualTo(25);
        verify(activityLog, times(2)).log(42L, 7L, ActivityType.MILESTONE_APPROVED, "Milestone #101 approved");
    }

    // ------------------------------------------------------------------
    // requestRevision()
    // ------------------------------------------------------------------

    @Test
    void requestRevision_setsStatusAttachesFeedbackAndKeepsProgress() {
        Project project = project(42L);
        Milestone milestone = milestone(project, 101L, 1, MilestoneStatus.SUBMITTED);
        Submission older  = new Submission(milestone, "v1", null, 1);
        Submission latest = new Submission(milestone, "v2", null, 2);
        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(milestone));
        when(submissionRepo.findFirstByMilestoneIdOrderByVersionNumberDesc(101L)).thenReturn(Optional.of(latest));

        service.requestRevision(101L, 7L, "Please use the brand palette");

        assertThat(milestone.getStatus()).isEqualTo(MilestoneStatus.REVISION_REQUESTED);
        assertThat(latest.getClientFeedback()).isEqualTo("Please use the brand palette");
        assertThat(older.getClientFeedback()).isNull();
        verifyNoInteractions(projectRepo);
        verify(activityLog).log(42L, 7L, ActivityType.REVISION_REQUESTED, "Revision requested for milestone #101");
    }

    @Test
    void requestRevision_approvedMilestone_isRejectedAndLeftApproved() {
        Milestone milestone = milestone(project(42L), 101L, 1, MilestoneStatus.APPROVED);
        when(milestoneRepo.findByIdForUpdate(101L)).thenReturn(Optional.of(milestone));

        assertThatThrownBy(() -> service.requestRevision(101L, 7L, "Changed my mind"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("APPROVED");

        assertThat(milestone.getStatus()).isEqualTo(MilestoneStatus.APPROVED);
        verify(milestoneRepo, never()).save(any());
        verifyNoInteractions(submissionRepo, projectRepo, activityLog);
    }

    // ------------------------------------------------------------------
    // updateProgress()
    // ------------------------------------------------------------------

    @Test
    void updateProgress_noMilestones_isZero() {
        Project project = project(42L);
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(List.of());

        assertThat(service.updateProgress(42L)).isZero();
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.ACTIVE);
    }

    @Test
    void updateProgress_roundsDown() {
        Project project = project(42L);
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(List.of(
                milestone(project, 101L, 1, MilestoneStatus.APPROVED),
                milestone(project, 102L, 2, MilestoneStatus.SUBMITTED),
                milestone(project, 103L, 3, MilestoneStatus.PENDING)));

        assertThat(service.updateProgress(42L)).isEqualTo(33);
        assertThat(project.getProgressPercentage()).isEqualTo(33);
        verify(projectRepo).save(project);
    }

    @Test
    void updateProgress_allApproved_completesProjectAndStampsTime() {
        Project project = project(42L);
        List<Milestone> milestones = fourMilestones(project);
        milestones.forEach(m -> m.setStatus(MilestoneStatus.APPROVED));
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        Instant before = Instant.now();
        assertThat(service.updateProgress(42L)).isEqualTo(100);

        assertThat(project.getStatus()).isEqualTo(ProjectStatus.COMPLETED);
        assertThat(project.getCompletedAt()).isNotNull().isAfterOrEqualTo(before);
    }

    @Test
    void updateProgress_alreadyCompleted_keepsOriginalCompletionTime() {
        Project project = project(42L);
        Instant firstCompletion = Instant.parse("2026-03-01T12:00:00Z");
        project.setStatus(ProjectStatus.COMPLETED);
        project.setCompletedAt(firstCompletion);
        List<Milestone> milestones = fourMilestones(project);
        milestones.forEach(m -> m.setStatus(MilestoneStatus.APPROVED));
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        service.updateProgress(42L);

        assertThat(project.getCompletedAt()).isEqualTo(firstCompletion);
    }

    @Test
    void updateProgress_allApprovedOnCancelledProject_staysCancelled() {
        Project project = project(42L);
        project.setStatus(ProjectStatus.CANCELLED);
        List<Milestone> milestones = fourMilestones(project);
        milestones.forEach(m -> m.setStatus(MilestoneStatus.APPROVED));
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        assertThat(service.updateProgress(42L)).isEqualTo(100);

        assertThat(project.getProgressPercentage()).isEqualTo(100);
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.CANCELLED);
        assertThat(project.getCompletedAt()).isNull();
        verify(projectRepo).save(project);
    }

    @Test
    void updateProgress_allApprovedOnDisputedProject_staysDisputed() {
        Project project = project(42L);
        project.setStatus(ProjectStatus.DISPUTED);
        List<Milestone> milestones = fourMilestones(project);
        milestones.forEach(m -> m.setStatus(MilestoneStatus.APPROVED));
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        service.updateProgress(42L);

        assertThat(project.getStatus()).isEqualTo(ProjectStatus.DISPUTED);
        assertThat(project.getCompletedAt()).isNull();
    }

    @Test
    void updateProgress_unknownProject_throwsNotFound() {
        when(projectRepo.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateProgress(404L))
                .isInstanceOf(WorkspaceNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // markDisputed() / cancelProject()
    // ------------------------------------------------------------------

    @Test
    void markDisputed_keepsProgressAndLogsReason() {
        Project project = project(42L);
        project.setProgressPercentage(50);
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));

        service.markDisputed(42L, 7L, "Missed deadline");

        assertThat(project.getStatus()).isEqualTo(ProjectStatus.DISPUTED);
        assertThat(project.getProgressPercentage()).isEqualTo(50);
        verify(projectRepo).save(project);
        verify(activityLog).log(42L, 7L, ActivityType.PROJECT_DISPUTED,
                "Project marked as disputed: Missed deadline");
    }

    @Test
    void markDisputed_completedProject_isAllowed() {
        Project project = project(42L);
        project.setStatus(ProjectStatus.COMPLETED);
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));

        service.markDisputed(42L, 3L, "Payment withheld");

        assertThat(project.getStatus()).isEqualTo(ProjectStatus.DISPUTED);
    }

    @Test
    void cancelProject_active_becomesCancelled() {
        Project project = project(42L);
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));

        service.cancelProject(42L, 7L, "Budget cut");

        assertThat(project.getStatus()).isEqualTo(ProjectStatus.CANCELLED);
        verify(activityLog).log(42L, 7L, ActivityType.PROJECT_CANCELLED, "Project cancelled: Budget cut");
    }

    @Test
    void cancelProject_notActive_isRejected() {
        Project project = project(42L);
        project.setStatus(ProjectStatus.COMPLETED);
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));

        assertThatThrownBy(() -> service.cancelProject(42L, 7L, "Changed my mind"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMPLETED");
        verify(projectRepo, never()).save(any());
        verifyNoInteractions(activityLog);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    void getWorkspace_unknownProject_isEmpty() {
        when(projectRepo.findById(404L)).thenReturn(Optional.empty());

        assertThat(service.getWorkspace(404L)).isEmpty();
        verifyNoInteractions(milestoneRepo);
    }

    @Test
    void getWorkspace_returnsMilestonesInOrder() {
        Project project = project(42L);
        List<Milestone> milestones = fourMilestones(project);
        when(projectRepo.findById(42L)).thenReturn(Optional.of(project));
        when(milestoneRepo.findByProjectIdOrderByOrderNumberAsc(42L)).thenReturn(milestones);

        WorkspaceView view = service.getWorkspace(42L).orElseThrow();

        assertThat(view.project()).isSameAs(project);
        assertThat(view.milestones()).extracting(Milestone::getOrderNumber).containsExactly(1, 2, 3, 4);
    }

    @Test
    void getFreelancerWorkspaces_onlyAsksForActiveProjects() {
        when(projectRepo.findByFreelancerIdAndStatusOrderByCreatedAtDesc(3L, ProjectStatus.ACTIVE))
                .thenReturn(List.of(project(42L)));

        assertThat(service.getFreelancerWorkspaces(3L)).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private List<Milestone> capturedMilestones() {
        ArgumentCaptor<List<Milestone>> captor = ArgumentCaptor.forClass(List.class);
        verify(milestoneRepo).saveAll(captor.capture());
        return captor.getValue();
    }

    private static List<Milestone> fourMilestones(Project project) {
        return List.of(
                milestone(project, 101L, 1, MilestoneStatus.PENDING),
                milestone(project, 102L, 2, MilestoneStatus.PENDING),
                milestone(project, 103L, 3, MilestoneStatus.PENDING),
                milestone(project, 104L, 4, MilestoneStatus.PENDING));
    }
}
