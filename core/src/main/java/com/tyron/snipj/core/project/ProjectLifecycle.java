package com.tyron.snipj.core.project;

import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.api.project.ProjectLifecycleListener;
import com.tyron.snipj.core.service.ProjectServiceManager;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Simple project lifecycle event dispatcher.
 */
public final class ProjectLifecycle {

    private static final Logger LOG = Logger.getLogger(ProjectLifecycle.class.getName());

    private ProjectLifecycle() {
    }

    public static void fireProjectOpened(Project project) {
        List<ProjectLifecycleListener> listeners = ProjectServiceManager.getExtensions(project, ProjectLifecycleListener.class);
        for (ProjectLifecycleListener l : listeners) {
            try {
                l.projectOpened(project);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "projectOpened listener failed listener=" + l.getClass().getName(), e);
            }
        }
    }

    public static void fireProjectClosing(Project project) {
        List<ProjectLifecycleListener> listeners = ProjectServiceManager.getExtensions(project, ProjectLifecycleListener.class);
        for (ProjectLifecycleListener l : listeners) {
            try {
                l.projectClosing(project);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "projectClosing listener failed listener=" + l.getClass().getName(), e);
            }
        }
    }
}
