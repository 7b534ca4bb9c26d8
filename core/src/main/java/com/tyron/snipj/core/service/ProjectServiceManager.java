package com.tyron.snipj.core.service;

import com.tyron.snipj.api.project.Project;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service locator for project-scoped services.
 * <p>
 * <b>Services:</b> Singleton per project (editor registry, snippet manager).
 * <p>
 * <b>Extensions:</b> Multiple instances per interface (lifecycle listeners, status indicators).
 */
public final class ProjectServiceManager {
    private static final Map<Project, ServiceContainer> projectContainers = new ConcurrentHashMap<>();

    private ProjectServiceManager() {
    }

    public static <T> T getService(Project project, Class<T> serviceClass) {
        checkOpen(project);
        return getContainer(project).getService(serviceClass);
    }

    public static <T, I extends T> void registerBinding(Project project, Class<T> interfaceClass, Class<I> implementationClass) {
        getContainer(project).registerBinding(interfaceClass, implementationClass);
    }

    /**
     * Registers a binding only if no binding exists yet and the service was not instantiated.
     */
    public static <T, I extends T> void registerBindingIfAbsent(Project project, Class<T> interfaceClass, Class<I> implementationClass) {
        getContainer(project).registerBindingIfAbsent(interfaceClass, implementationClass);
    }

    public static <T> void registerInstance(Project project, Class<T> serviceClass, T instance) {
        getContainer(project).registerInstance(serviceClass, instance);
    }

    /**
     * Registers an implementation for an extension point.
     * <pre>
     * registerExtension(project, EditorManagerListener.class, SnippetEditorListener.class);
     * </pre>
     */
    public static <E, I extends E> void registerExtension(Project project, Class<E> extensionPoint, Class<I> extensionImpl) {
        getContainer(project).registerExtension(extensionPoint, extensionImpl);
    }

    public static <E> void registerExtensionInstance(Project project, Class<E> extensionPoint, E extension) {
        getContainer(project).registerExtensionInstance(extensionPoint, extension);
    }

    /**
     * @return An unmodifiable list of the extensions, instantiated lazily on first access.
     */
    public static <E> List<E> getExtensions(Project project, Class<E> extensionPoint) {
        checkOpen(project);
        return getContainer(project).getExtensions(extensionPoint);
    }

    public static void disposeProject(Project project) {
        ServiceContainer container = projectContainers.remove(project);
        if (container != null) {
            container.disposeAll();
        }
    }

    private static void checkOpen(Project project) {
        if (!project.isOpen()) {
            throw new IllegalStateException("Cannot access services for a closed project: " + project.getName());
        }
    }

    private static ServiceContainer getContainer(Project project) {
        return projectContainers.computeIfAbsent(project, p ->
            new DefaultServiceContainer(ServiceContext.project(p)));
    }
}
