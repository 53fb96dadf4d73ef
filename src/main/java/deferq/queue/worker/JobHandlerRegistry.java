package deferq.queue.worker;

import deferq.queue.model.UnknownJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps job names to their handlers.
 * Thread-safe: handlers may be registered while workers are running.
 *
 * A name that was never registered is looked up as the fully qualified name
 * of a public {@link JobHandler} class with a no-arg constructor. The
 * instance is then cached under that name.
 */
public class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final ClassLoader classLoader;

    public JobHandlerRegistry() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public JobHandlerRegistry(ClassLoader classLoader) {
        this.classLoader = classLoader != null ? classLoader : JobHandlerRegistry.class.getClassLoader();
    }

    /**
     * Registry pre-filled with the handlers declared in
     * {@code META-INF/services/deferq.queue.worker.JobHandler}, each under its
     * class name.
     */
    public static JobHandlerRegistry discover() {
        JobHandlerRegistry registry = new JobHandlerRegistry();
        ServiceLoader.load(JobHandler.class, registry.classLoader).stream()
                .forEach(provider -> registry.register(provider.type().getName(), provider.get()));
        log.info("Discovered {} job handlers", registry.handlers.size());
        return registry;
    }

    /**
     * Register a handler under the given name.
     *
     * @throws IllegalArgumentException if the name is blank
     */
    public JobHandlerRegistry register(String name, JobHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("job name is required");
        }
        JobHandler previous = handlers.put(name, handler);
        if (previous != null) {
            log.warn("Handler for job {} replaced", name);
        } else {
            log.debug("Registered job handler: {}", name);
        }
        return this;
    }

    /**
     * Find the handler of a job name.
     *
     * @throws UnknownJobException if nothing is registered under this name and
     *                             it does not name a handler class
     */
    public JobHandler resolve(String name) {
        JobHandler handler = handlers.get(name);
        if (handler != null) {
            return handler;
        }
        return handlers.computeIfAbsent(name, this::load);
    }

    public boolean isRegistered(String name) {
        return handlers.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(handlers.keySet());
    }

    private JobHandler load(String className) {
        Class<?> type;
        try {
            // not initialized until we know it is a handler
            type = Class.forName(className, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new UnknownJobException(className, e);
        }

        if (!JobHandler.class.isAssignableFrom(type) || Modifier.isAbstract(type.getModifiers())) {
            throw new UnknownJobException(className);
        }

        try {
            JobHandler handler = (JobHandler) type.getDeclaredConstructor().newInstance();
            log.debug("Loaded job handler class: {}", className);
            return handler;
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new UnknownJobException(className, e);
        }
    }
}
