package io.surfworks.qhal.cli;

import io.surfworks.qhal.capability.GateSet;
import io.surfworks.qhal.testing.MockCircuit;

/**
 * Parses the {@code --gates} argument into a circuit.
 *
 * <p>Format: comma-separated gates, each {@code name[:q0[:q1...]]}. A gate
 * without operands acts on qubits {@code 0..arity-1}, where the arity comes
 * from the gate set (1 for gates the set does not know).
 */
final class GateSpec {

    private GateSpec() {
    }

    static MockCircuit parse(String spec, int numQubits, GateSet gateSet) {
        MockCircuit circuit = MockCircuit.of(numQubits);
        if (spec.isBlank()) {
            return circuit;
        }
        for (String token : spec.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("Empty gate in: " + spec);
            }
            String[] parts = trimmed.split(":");
            String name = parts[0];
            int[] qubits;
            if (parts.length > 1) {
                qubits = new int[parts.length - 1];
                for (int i = 1; i < parts.length; i++) {
                    qubits[i - 1] = parseQubit(parts[i], trimmed);
                }
            } else {
                int arity = Math.max(1, gateSet.arityOf(name));
                qubits = new int[arity];
                for (int i = 0; i < arity; i++) {
                    qubits[i] = i;
                }
            }
            circuit = circuit.gate(name, qubits);
        }
        return circuit;
    }

    private static int parseQubit(String value, String token) {
        try {
            int q = Integer.parseInt(value.trim());
            if (q < 0) {
                throw new IllegalArgumentException("Negative qubit index in gate: " + token);
            }
            return q;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid qubit index in gate: " + token, e);
        }
    }
}
