package com.seekit.workspace.service;

import com.seekit.workspace.model.Milestone;
import com.seekit.workspace.model.Project;

import java.util.List;

/**
 * A project together with its milestones in delivery order.
 */
public record WorkspaceView(Project project, List<Milestone> milestones) {}
