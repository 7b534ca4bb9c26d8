package com.tyron.snipj.core.service;

import com.tyron.snipj.api.project.Project;

/**
 * Context passed to a {@link ServiceContainer}: either the application scope or one project.
 */
public final class ServiceContext {

    private final Project project;

    private ServiceContext(Project project) {
        this.project = project;
    }

    public static ServiceContext project(Project project) {
        if (project == null) throw new IllegalArgumentException("project == null");
        return new ServiceContext(project);
    }

    public static ServiceContext application() {
        return new ServiceContext(null);
    }

    /**
     * @return The project for project-scoped containers, or null for the application container.
     */
    public Project getProjectOrNull() {
        return project;
    }
}
