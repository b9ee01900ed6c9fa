package com.seekit.workspace.repository;

import com.seekit.workspace.model.ActivityLogEntry;
import org.springframework.data.repository.Repository;

import java.util.List;

/**
 * Append + read access to the activity_log table.
 *
 * Extends the bare Repository marker instead of JpaRepository so that
 * no delete or bulk-update methods are generated for this table.
 */
public interface ActivityLogRepository extends Repository<ActivityLogEntry, Long> {

    ActivityLogEntry save(ActivityLogEntry entry);

    /** Newest first; id breaks ties between entries written in the same instant. */
    List<ActivityLogEntry> findByProjectIdOrderByCreatedAtDescIdDesc(Long projectId);
}
