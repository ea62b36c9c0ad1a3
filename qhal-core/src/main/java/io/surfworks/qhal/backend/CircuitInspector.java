package io.surfworks.qhal.backend;

/**
 * Extracts a {@link CircuitProfile} from a backend's own circuit type.
 *
 * @param <C> the circuit representation
 */
@FunctionalInterface
public interface CircuitInspector<C> {

    /**
     * Describes the circuit's width and gate applications.
     *
     * @param circuit the circuit to inspect
     * @return its profile
     */
    CircuitProfile profile(C circuit);
}
