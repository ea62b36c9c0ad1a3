package io.surfworks.qhal.backend;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The parts of a circuit that capability checks need: its width and the
 * gates it applies. Backends derive it from their own circuit type through a
 * {@link CircuitInspector}.
 *
 * @param numQubits Number of qubits the circuit uses
 * @param gates     Gate applications in program order
 */
public record CircuitProfile(int numQubits, List<GateApplication> gates) {

    /**
     * One gate applied to a list of qubit operands.
     */
    public record GateApplication(String gate, List<Integer> qubits) {

        public GateApplication {
            Objects.requireNonNull(gate, "gate cannot be null");
            qubits = qubits == null ? List.of() : List.copyOf(qubits);
        }

        public static GateApplication of(String gate, int... qubits) {
            return new GateApplication(gate, Arrays.stream(qubits).boxed().toList());
        }

        public int arity() {
            return qubits.size();
        }
    }

    public CircuitProfile {
        if (numQubits < 0) {
            throw new IllegalArgumentException("numQubits cannot be negative");
        }
        gates = gates == null ? List.of() : List.copyOf(gates);
    }
}
