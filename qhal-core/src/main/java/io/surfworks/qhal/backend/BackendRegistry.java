package io.surfworks.qhal.backend;

import io.surfworks.qhal.capability.Capabilities;
import io.surfworks.qhal.error.HalException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of backend factories, keyed by lowercase name.
 *
 * <p>Each factory is registered together with the circuit type its backends
 * accept, so a lookup hands back a {@code Backend<C>} the caller can submit
 * to without casting. Lookups that fail are reported as
 * {@link io.surfworks.qhal.error.HalErrorKind#CONFIGURATION} errors.
 *
 * <p>Thread-safe. Every {@link #create} call builds a new backend instance.
 */
public final class BackendRegistry {

    /**
     * Builds a backend for a device description.
     *
     * @param <C> circuit type the backend accepts
     */
    @FunctionalInterface
    public interface BackendFactory<C> {
        Backend<C> create(Capabilities device) throws HalException;
    }

    private record Registration<C>(Class<C> circuitType, BackendFactory<C> factory) {
    }

    private static final Map<String, Registration<?>> REGISTRATIONS = new ConcurrentHashMap<>();

    private BackendRegistry() {} // Utility class

    /**
     * Registers a backend factory, replacing any existing one with the same name.
     *
     * @param name        Backend name (e.g., "mock", "iqm-garnet")
     * @param circuitType Circuit type the created backends accept
     * @param factory     Factory that creates backend instances
     */
    public static <C> void register(String name, Class<C> circuitType, BackendFactory<C> factory) {
        Objects.requireNonNull(circuitType, "circuitType cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        REGISTRATIONS.put(key(name), new Registration<>(circuitType, factory));
    }

    public static void unregister(String name) {
        REGISTRATIONS.remove(key(name));
    }

    public static boolean isRegistered(String name) {
        return REGISTRATIONS.containsKey(key(name));
    }

    /**
     * Creates a new backend for the device.
     *
     * @param name        registered backend name, case-insensitive
     * @param circuitType circuit type the caller will submit
     * @param device      capabilities of the device to drive
     * @throws HalException CONFIGURATION if the name is not registered or its
     *                      backends do not accept {@code circuitType}; any
     *                      error the factory raises is passed through
     */
    public static <C> Backend<C> create(String name, Class<C> circuitType, Capabilities device)
            throws HalException {
        Registration<?> registration = REGISTRATIONS.get(key(name));
        if (registration == null) {
            throw HalException.configuration(
                    "Backend '" + name + "' not registered. Available: " + available());
        }
        if (!registration.circuitType().isAssignableFrom(circuitType)) {
            throw HalException.configuration("Backend '" + name + "' accepts "
                    + registration.circuitType().getSimpleName() + " circuits, not "
                    + circuitType.getSimpleName());
        }
        // A backend accepting a supertype of C accepts every C
        @SuppressWarnings("unchecked")
        BackendFactory<C> factory = (BackendFactory<C>) registration.factory();
        return factory.create(device);
    }

    /**
     * Returns the registered backend names, sorted.
     */
    public static List<String> available() {
        return REGISTRATIONS.keySet().stream().sorted().toList();
    }

    /**
     * Clears all registered backends (mainly for testing).
     */
    public static void clear() {
        REGISTRATIONS.clear();
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
