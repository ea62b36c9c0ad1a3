package io.surfworks.qhal.capability;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Gate set supported by a backend.
 *
 * <p>Gate names follow the OpenQASM 3 convention and are lowercased on
 * construction ({@code h}, {@code cx}, {@code rz}, {@code prx}, ...).
 *
 * <p>{@code nativeGates} lists the gates that execute without decomposition.
 * When it is empty every supported gate is treated as native, which is the
 * usual case for simulators.
 *
 * @param singleQubit Single-qubit gates supported
 * @param twoQubit    Two-qubit gates supported
 * @param threeQubit  Three-qubit gates supported
 * @param nativeGates Gates executed without decomposition (may be empty)
 */
public record GateSet(
        List<String> singleQubit,
        List<String> twoQubit,
        List<String> threeQubit,
        List<String> nativeGates
) {

    public GateSet {
        singleQubit = normalize(singleQubit);
        twoQubit = normalize(twoQubit);
        threeQubit = normalize(threeQubit);
        nativeGates = normalize(nativeGates);
    }

    /**
     * IQM gate set (PRX + CZ native).
     */
    public static GateSet iqm() {
        return new GateSet(List.of("prx"), List.of("cz"), List.of(), List.of("prx", "cz"));
    }

    /**
     * IBM Eagle gate set (127-qubit processors). Native: ecr, rz, sx, x.
     */
    public static GateSet ibmEagle() {
        return new GateSet(
                List.of("rz", "sx", "x", "id"),
                List.of("ecr"),
                List.of(),
                List.of("rz", "sx", "x", "ecr"));
    }

    /**
     * IBM Heron gate set (156-qubit processors). Native: cz, rz, sx, x plus rx, rzz, h.
     */
    public static GateSet ibmHeron() {
        return new GateSet(
                List.of("rz", "sx", "x", "id", "rx", "h"),
                List.of("cz", "rzz"),
                List.of(),
                List.of("rz", "sx", "x", "cz", "id", "rx", "h", "rzz"));
    }

    /**
     * Universal gate set with an empty native list, typical for simulators.
     */
    public static GateSet universal() {
        return new GateSet(
                List.of("id", "x", "y", "z", "h", "s", "sdg", "t", "tdg",
                        "sx", "sxdg", "rx", "ry", "rz", "p", "u", "prx"),
                List.of("cx", "cy", "cz", "ch", "swap", "iswap",
                        "crx", "cry", "crz", "cp", "rxx", "ryy", "rzz"),
                List.of("ccx", "cswap"),
                List.of());
    }

    /**
     * Rigetti gate set (RX, RZ, CZ native).
     */
    public static GateSet rigetti() {
        return new GateSet(List.of("rx", "rz"), List.of("cz"), List.of(), List.of("rx", "rz", "cz"));
    }

    /**
     * IonQ gate set (RX, RY, RZ, XX native).
     */
    public static GateSet ionq() {
        return new GateSet(List.of("rx", "ry", "rz"), List.of("xx"), List.of(), List.of("rx", "ry", "rz", "xx"));
    }

    /**
     * Neutral-atom gate set (RZ, RX, RY, CZ native).
     */
    public static GateSet neutralAtom() {
        return new GateSet(List.of("rz", "rx", "ry"), List.of("cz"), List.of(), List.of("rz", "rx", "ry", "cz"));
    }

    /**
     * Returns true if the gate appears in any arity bucket.
     */
    public boolean contains(String gate) {
        String name = canonical(gate);
        return singleQubit.contains(name) || twoQubit.contains(name) || threeQubit.contains(name);
    }

    /**
     * Returns true if the gate executes without decomposition.
     * Falls back to {@link #contains(String)} when the native list is empty.
     */
    public boolean isNative(String gate) {
        if (nativeGates.isEmpty()) {
            return contains(gate);
        }
        return nativeGates.contains(canonical(gate));
    }

    /**
     * Returns the number of qubits the gate acts on, or 0 if it is not supported.
     */
    public int arityOf(String gate) {
        String name = canonical(gate);
        if (singleQubit.contains(name)) return 1;
        if (twoQubit.contains(name)) return 2;
        if (threeQubit.contains(name)) return 3;
        return 0;
    }

    /**
     * Returns the total number of distinct supported gates.
     */
    public int size() {
        return singleQubit.size() + twoQubit.size() + threeQubit.size();
    }

    static String canonical(String gate) {
        Objects.requireNonNull(gate, "gate cannot be null");
        return gate.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> normalize(List<String> gates) {
        if (gates == null) {
            return List.of();
        }
        return gates.stream()
                .map(GateSet::canonical)
                .distinct()
                .toList();
    }
}
