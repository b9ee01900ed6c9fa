package com.seekit.workspace.model;

import java.time.LocalDate;

/**
 * Blueprint for one milestone created together with a workspace.
 *
 * Order numbers are not part of the template: they follow the position
 * of the template in the list passed to createWorkspace (1-based).
 *
 * @param name        display name, e.g. "Initial Design"
 * @param description short description shown next to the name
 * @param dueDate     optional deadline; null when the job has none
 */
public record MilestoneTemplate(String name, String description, LocalDate dueDate) {}
