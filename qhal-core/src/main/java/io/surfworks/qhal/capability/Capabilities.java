package io.surfworks.qhal.capability;

import java.util.List;
import java.util.Objects;

/**
 * Static description of a backend: qubit count, gates, connectivity, shot
 * limit and noise characteristics.
 *
 * <p>A backend builds this once and serves it from {@code capabilities()}
 * without I/O. Instances are immutable snapshots; the {@code with*} methods
 * return copies.
 *
 * @param name         Name of the backend
 * @param numQubits    Number of qubits available
 * @param gateSet      Supported gates (OpenQASM 3 names)
 * @param topology     Qubit connectivity; all edges are bidirectional
 * @param maxShots     Maximum shots per job
 * @param simulator    Whether this is a simulator rather than hardware
 * @param features     Free-form feature tags
 * @param noiseProfile Device-wide noise averages (null if unknown)
 */
public record Capabilities(
        String name,
        int numQubits,
        GateSet gateSet,
        Topology topology,
        int maxShots,
        boolean simulator,
        List<String> features,
        NoiseProfile noiseProfile
) {

    public static final int DEFAULT_MAX_SHOTS = 100_000;

    public Capabilities {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(gateSet, "gateSet cannot be null");
        Objects.requireNonNull(topology, "topology cannot be null");
        if (numQubits < 0) {
            throw new IllegalArgumentException("numQubits cannot be negative");
        }
        if (maxShots < 1) {
            throw new IllegalArgumentException("maxShots must be positive");
        }
        features = features == null ? List.of() : List.copyOf(features);
    }

    /**
     * Ideal simulator: universal gates, all-to-all connectivity.
     */
    public static Capabilities simulator(int numQubits) {
        return new Capabilities("simulator", numQubits, GateSet.universal(), Topology.full(numQubits),
                DEFAULT_MAX_SHOTS, true, List.of("statevector", "unitary"), null);
    }

    /**
     * IQM devices (Garnet, Adonis).
     */
    public static Capabilities iqm(String name, int numQubits) {
        return new Capabilities(name, numQubits, GateSet.iqm(), Topology.star(numQubits),
                20_000, false, List.of(), null);
    }

    /**
     * IBM Eagle processors. The topology is empty; attach the real coupling
     * map with {@link #withTopology(Topology)}.
     */
    public static Capabilities ibmEagle(String name, int numQubits) {
        return new Capabilities(name, numQubits, GateSet.ibmEagle(), Topology.custom(List.of()),
                DEFAULT_MAX_SHOTS, false, List.of("dynamic_circuits"), null);
    }

    /**
     * IBM Heron processors. The topology is empty; attach the real coupling
     * map with {@link #withTopology(Topology)}.
     */
    public static Capabilities ibmHeron(String name, int numQubits) {
        return new Capabilities(name, numQubits, GateSet.ibmHeron(), Topology.custom(List.of()),
                DEFAULT_MAX_SHOTS, false, List.of("dynamic_circuits"), null);
    }

    /**
     * Neutral-atom devices (planqc, Pasqal) with the given number of zones.
     */
    public static Capabilities neutralAtom(String name, int numQubits, int zones) {
        return new Capabilities(name, numQubits, GateSet.neutralAtom(), Topology.neutralAtom(numQubits, zones),
                DEFAULT_MAX_SHOTS, false, List.of("shuttling", "zoned"), null);
    }

    /**
     * Rigetti superconducting devices on the smallest square grid holding every qubit.
     */
    public static Capabilities rigetti(String name, int numQubits) {
        int side = (int) Math.ceil(Math.sqrt(numQubits));
        return new Capabilities(name, numQubits, GateSet.rigetti(), Topology.grid(side, side),
                DEFAULT_MAX_SHOTS, false, List.of(), null);
    }

    /**
     * IonQ trapped-ion devices (all-to-all).
     */
    public static Capabilities ionq(String name, int numQubits) {
        return new Capabilities(name, numQubits, GateSet.ionq(), Topology.full(numQubits),
                DEFAULT_MAX_SHOTS, false, List.of(), null);
    }

    /**
     * Returns a copy with the given connectivity.
     */
    public Capabilities withTopology(Topology newTopology) {
        return new Capabilities(name, numQubits, gateSet, newTopology, maxShots, simulator, features, noiseProfile);
    }

    /**
     * Returns a copy with the given noise profile.
     */
    public Capabilities withNoiseProfile(NoiseProfile profile) {
        return new Capabilities(name, numQubits, gateSet, topology, maxShots, simulator, features, profile);
    }

    /**
     * Returns a copy with a different name.
     */
    public Capabilities withName(String newName) {
        return new Capabilities(newName, numQubits, gateSet, topology, maxShots, simulator, features, noiseProfile);
    }

    /**
     * Returns a copy with a different shot limit.
     */
    public Capabilities withMaxShots(int shots) {
        return new Capabilities(name, numQubits, gateSet, topology, shots, simulator, features, noiseProfile);
    }

    public boolean hasFeature(String feature) {
        return features.contains(feature);
    }

    /**
     * Returns true if {@code shots} is within {@code 1..maxShots}.
     */
    public boolean acceptsShots(int shots) {
        return shots > 0 && shots <= maxShots;
    }
}
