package org.agentworld.node.spi;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed holder of the objects controllers may use, filled by the HTTP server process.
 */
public final class ServiceRegistry {

    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if {@code instance} is not a {@code type} or an object is
     *                                  already registered for {@code type}.
     */
    public void register(final Class<?> type, final Object instance) {
        if (!type.isInstance(instance)) {
            throw new IllegalArgumentException(instance.getClass().getName() + " is not a " + type.getName());
        }
        if (services.putIfAbsent(type, instance) != null) {
            throw new IllegalArgumentException("Service of type " + type.getName() + " is already registered.");
        }
    }

    /**
     * @throws IllegalArgumentException if nothing is registered for {@code type}.
     */
    public <T> T get(final Class<T> type) {
        final Object instance = services.get(type);
        if (instance == null) {
            throw new IllegalArgumentException("No service registered for type " + type.getName());
        }
        return type.cast(instance);
    }

    public boolean hasService(final Class<?> type) {
        return services.containsKey(type);
    }
}
