package com.seekit.workspace.config;

import com.seekit.workspace.model.MilestoneTemplate;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Settings under the {@code seekit.workspace} prefix.
 *
 * @param defaultMilestones milestone plan used when a workspace is created without
 *                          an explicit list. Falls back to the four-stage plan below
 *                          when the property is missing or empty.
 */
@ConfigurationProperties(prefix = "seekit.workspace")
public record WorkspaceProperties(List<MilestoneTemplate> defaultMilestones) {

    public static final List<MilestoneTemplate> STANDARD_MILESTONES = List.of(
            new MilestoneTemplate("Initial Design", "Design phase and planning", null),
            new MilestoneTemplate("Development",    "Core development work", null),
            new MilestoneTemplate("Testing",        "Testing and quality assurance", null),
            new MilestoneTemplate("Final Delivery", "Final deliverable submission", null)
    );

    public WorkspaceProperties {
        if (defaultMilestones == null || defaultMilestones.isEmpty()) {
            defaultMilestones = STANDARD_MILESTONES;
        } else {
            defaultMilestones = List.copyOf(defaultMilestones);
        }
    }
}
