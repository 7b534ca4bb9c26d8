package com.tyron.snipj.core.service;

import com.tyron.snipj.api.project.Project;
import com.tyron.snipj.api.service.Disposable;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link ServiceContainer} implementation.
 * <p>
 * - Lazy service creation with cycle detection
 * - Lazy extension instantiation, in registration order
 * - Services with a {@code (Project)} constructor receive the container's project
 */
public class DefaultServiceContainer implements ServiceContainer {

    private static final Logger LOG = Logger.getLogger(DefaultServiceContainer.class.getName());

    private final ServiceContext context;

    private final Object lock = new Object();
    private final Map<Class<?>, Object> services = new LinkedHashMap<>();
    private final Map<Class<?>, Class<?>> serviceBindings = new LinkedHashMap<>();
    private final Map<Class<?>, List<Object>> extensionDefinitions = new LinkedHashMap<>();
    private final Map<Class<?>, List<Object>> extensionCache = new LinkedHashMap<>();

    private final Deque<Class<?>> instantiationStack = new ArrayDeque<>();

    public DefaultServiceContainer(ServiceContext context) {
        if (context == null) throw new IllegalArgumentException("context == null");
        this.context = context;
    }

    @Override
    public ServiceContext getContext() {
        return context;
    }

    @Override
    public <T> T getService(Class<T> key) {
        synchronized (lock) {
            Object existing = services.get(key);
            if (existing != null) {
                return key.cast(existing);
            }
            if (instantiationStack.contains(key)) {
                throw new ServiceInstantiationException("Cyclic dependency while creating: " + key.getName(), null);
            }

            instantiationStack.push(key);
            try {
                Class<?> actualClass = serviceBindings.getOrDefault(key, key);
                Object created = instantiate(actualClass);
                services.put(key, created);
                return key.cast(created);
            } finally {
                instantiationStack.pop();
            }
        }
    }

    @Override
    public <T, I extends T> void registerBinding(Class<T> interfaceClass, Class<I> implClass) {
        synchronized (lock) {
            if (services.containsKey(interfaceClass)) {
                throw new IllegalStateException("Cannot bind " + interfaceClass.getName() + " because it is already instantiated.");
            }
            serviceBindings.put(interfaceClass, implClass);
        }
    }

    @Override
    public <T, I extends T> void registerBindingIfAbsent(Class<T> interfaceClass, Class<I> implClass) {
        synchronized (lock) {
            if (services.containsKey(interfaceClass)) {
                return;
            }
            serviceBindings.putIfAbsent(interfaceClass, implClass);
        }
    }

    @Override
    public <T> void registerInstance(Class<T> serviceClass, T instance) {
        synchronized (lock) {
            services.put(serviceClass, instance);
        }
    }

    @Override
    public <E, I extends E> void registerExtension(Class<E> point, Class<I> impl) {
        addExtensionDefinition(point, impl);
    }

    @Override
    public <E> void registerExtensionInstance(Class<E> point, E extension) {
        addExtensionDefinition(point, extension);
    }

    private void addExtensionDefinition(Class<?> point, Object definition) {
        synchronized (lock) {
            // Invalidate cache if new extensions are added at runtime.
            extensionCache.remove(point);
            extensionDefinitions.computeIfAbsent(point, k -> new ArrayList<>()).add(definition);
        }
    }

    @Override
    public <E> List<E> getExtensions(Class<E> point) {
        synchronized (lock) {
            List<Object> cached = extensionCache.get(point);
            if (cached == null) {
                List<Object> definitions = extensionDefinitions.getOrDefault(point, List.of());
                List<Object> instances = new ArrayList<>(definitions.size());
                for (Object definition : definitions) {
                    instances.add(definition instanceof Class<?> impl ? instantiate(impl) : definition);
                }
                cached = Collections.unmodifiableList(instances);
                extensionCache.put(point, cached);
            }

            List<E> result = new ArrayList<>(cached.size());
            for (Object o : cached) {
                result.add(point.cast(o));
            }
            return Collections.unmodifiableList(result);
        }
    }

    private Object instantiate(Class<?> clazz) {
        Project project = context.getProjectOrNull();
        if (project != null) {
            try {
                Constructor<?> constructor = clazz.getConstructor(Project.class);
                return constructor.newInstance(project);
            } catch (NoSuchMethodException ignored) {
                // fall back to no-arg
            } catch (InvocationTargetException e) {
                throw new ServiceInstantiationException(
                        "Class " + clazz.getName() + " threw an exception during initialization.", e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new ServiceInstantiationException("Failed to instantiate " + clazz.getName(), e);
            }
        }

        try {
            return clazz.getConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new ServiceInstantiationException(
                    "Class " + clazz.getName() + " must have a public constructor(Project) or a public no-arg constructor.", e);
        } catch (InvocationTargetException e) {
            throw new ServiceInstantiationException(
                    "Class " + clazz.getName() + " threw an exception during initialization.", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ServiceInstantiationException("Failed to instantiate " + clazz.getName(), e);
        }
    }

    @Override
    public void disposeAll() {
        List<Object> toDispose = new ArrayList<>();
        synchronized (lock) {
            toDispose.addAll(services.values());
            for (List<Object> extensions : extensionCache.values()) {
                toDispose.addAll(extensions);
            }
            services.clear();
            serviceBindings.clear();
            extensionCache.clear();
            extensionDefinitions.clear();
        }

        for (Object obj : toDispose) {
            if (obj instanceof Disposable disposable) {
                try {
                    disposable.dispose();
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "dispose failed service=" + obj.getClass().getName(), e);
                }
            }
        }
    }
}
