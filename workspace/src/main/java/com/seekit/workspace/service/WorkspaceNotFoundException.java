package com.seekit.workspace.service;

/**
 * Thrown when a write operation references a project or milestone that does not exist.
 *
 * Read paths never throw this; they return Optional.empty() or an empty list instead.
 */
public class WorkspaceNotFoundException extends RuntimeException {

    public WorkspaceNotFoundException(String resource, Long id) {
        super(resource + " not found: " + id);
    }
}
