package com.seekit.workspace.service;

import com.seekit.workspace.model.ActivityLogEntry;
import com.seekit.workspace.repository.ActivityLogRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only audit trail for project workspaces.
 *
 * Every appended entry is also counted:
 * <pre>
 *   seekit.workspace.activity{type="workspace_created|milestone_approved|..."}
 * </pre>
 */
@Service
public class ActivityLogService {

    private static final Logger log = LoggerFactory.getLogger(ActivityLogService.class);

    private final ActivityLogRepository repo;
    private final MeterRegistry         meterRegistry;

    public ActivityLogService(ActivityLogRepository repo, MeterRegistry meterRegistry) {
        this.repo          = repo;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Append one entry. Joins the caller's transaction, so the entry is rolled
     * back together with the state change it describes.
     */
    @Transactional
    public ActivityLogEntry log(Long projectId, Long userId, String activityType, String description) {
        ActivityLogEntry entry = repo.save(new ActivityLogEntry(projectId, userId, activityType, description));
        meterRegistry.counter("seekit.workspace.activity", "type", activityType).increment();
        log.debug("Project {}: [{}] {} (user={})", projectId, activityType, description, userId);
        return entry;
    }

    /** Entries for a project, newest first. */
    @Transactional(readOnly = true)
    public List<ActivityLogEntry> history(Long projectId) {
        return repo.findByProjectIdOrderByCreatedAtDescIdDesc(projectId);
    }
}
