package com.tyron.snipj.core.service;

import com.tyron.snipj.api.snippet.Clipboard;
import com.tyron.snipj.core.snippet.InMemoryClipboard;

/**
 * Application-scoped service container: the root scope, shared by all projects.
 */
public final class ApplicationServiceManager {

    private static final ServiceContainer container =
            new DefaultServiceContainer(ServiceContext.application());

    static {
        installDefaultBindings();
    }

    private ApplicationServiceManager() {
    }

    public static <T> T getService(Class<T> serviceClass) {
        return container.getService(serviceClass);
    }

    public static <T, I extends T> void registerBinding(Class<T> interfaceClass, Class<I> implementationClass) {
        container.registerBinding(interfaceClass, implementationClass);
    }

    public static <T> void registerInstance(Class<T> serviceClass, T instance) {
        container.registerInstance(serviceClass, instance);
    }

    /**
     * Disposes all application-scoped services and reinstalls the default bindings.
     * <p>
     * Note: project containers are disposed separately via {@link ProjectServiceManager#disposeProject}.
     */
    public static void disposeApplication() {
        container.disposeAll();
        installDefaultBindings();
    }

    private static void installDefaultBindings() {
        container.registerBindingIfAbsent(Clipboard.class, InMemoryClipboard.class);
    }
}
