package com.questrail.framebus.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TypeRegistry
 * -----------------------------------------------------------------------------
 * Name to factory mapping for one capability (frames or ports).
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>The first registration of a name wins; later ones are rejected and
 *       logged.</li>
 *   <li>There is no unregistration.</li>
 *   <li>{@link #create} runs the factory after the registry lock has been
 *       released, so a factory may consult the registry itself.</li>
 * </ul>
 *
 * @param <B> the base kind produced by the registered factories
 */
public final class TypeRegistry<B>
{
    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    private final String capability;

    private final Object lock = new Object();
    private final Map<String, TypeFactory<B>> factories = new HashMap<>();

    /**
     * @param capability label used in log messages, e.g. {@code "frame"}
     */
    public TypeRegistry(String capability) {
        this.capability = Objects.requireNonNull(capability, "capability");
    }

    /**
     * @return {@code false} if {@code name} is already registered; the existing
     *         factory is kept
     */
    public boolean register(String name, TypeFactory<B> factory) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        synchronized (lock) {
            if (factories.containsKey(name)) {
                log.warn("Rejected duplicate {} type '{}'", capability, name);
                return false;
            }
            factories.put(name, factory);
        }
        log.debug("Registered {} type '{}'", capability, name);
        return true;
    }

    public boolean register(TypeDescriptor<B> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return register(descriptor.name(), descriptor.factory());
    }

    /**
     * Creates an instance of {@code typeName}.
     *
     * @param instanceName null or blank defaults to {@code typeName}
     * @return empty if the type is not registered
     */
    public Optional<B> create(String typeName, String instanceName, BusContext context) {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(context, "context");

        final TypeFactory<B> factory;
        synchronized (lock) {
            factory = factories.get(typeName);
        }
        if (factory == null) {
            log.debug("No {} type '{}' registered", capability, typeName);
            return Optional.empty();
        }

        String name = (instanceName == null || instanceName.isBlank()) ? typeName : instanceName;
        return Optional.ofNullable(factory.create(name, context));
    }

    public boolean contains(String typeName) {
        synchronized (lock) {
            return factories.containsKey(typeName);
        }
    }

    public List<String> listNames() {
        List<String> names;
        synchronized (lock) {
            names = new ArrayList<>(factories.keySet());
        }
        Collections.sort(names);
        return Collections.unmodifiableList(names);
    }
}
