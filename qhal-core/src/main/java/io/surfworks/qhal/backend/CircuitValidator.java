package io.surfworks.qhal.backend;

import io.surfworks.qhal.capability.Capabilities;
import io.surfworks.qhal.capability.GateSet;
import io.surfworks.qhal.capability.Topology;
import io.surfworks.qhal.capability.TopologyKind;
import io.surfworks.qhal.error.HalException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks a {@link CircuitProfile} against a backend's {@link Capabilities}.
 *
 * <p>A circuit is invalid when it is wider than the device, addresses a qubit
 * that does not exist, uses a gate the device cannot run at all, or applies a
 * gate to the wrong number of operands. It needs transpilation when every gate
 * is supported but some are not native, or when a multi-qubit gate acts on
 * qubits that are not coupled. An empty custom topology means the coupling map
 * is unknown and connectivity is not checked.
 */
public final class CircuitValidator {

    private CircuitValidator() {
    }

    /**
     * Validates a circuit profile.
     *
     * @param capabilities the backend's capabilities
     * @param profile      the circuit to check
     * @return valid, invalid with every reason found, or needs-transpilation
     */
    public static ValidationResult validate(Capabilities capabilities, CircuitProfile profile) {
        Findings findings = inspect(capabilities, profile);
        if (!findings.reasons.isEmpty()) {
            return ValidationResult.invalid(List.copyOf(findings.reasons));
        }
        if (!findings.transpilation.isEmpty()) {
            return ValidationResult.needsTranspilation(String.join("; ", findings.transpilation));
        }
        return ValidationResult.valid();
    }

    /**
     * Validates a circuit for submission, throwing the matching error kind when
     * it cannot be submitted as-is.
     *
     * @throws HalException CIRCUIT_TOO_LARGE when the circuit is wider than the device,
     *                      UNSUPPORTED when it uses unknown gates,
     *                      INVALID_CIRCUIT for any other problem, including a
     *                      circuit that still needs transpilation
     */
    public static void requireSubmittable(Capabilities capabilities, CircuitProfile profile) throws HalException {
        Findings findings = inspect(capabilities, profile);
        if (findings.tooLarge) {
            throw HalException.circuitTooLarge(String.join("; ", findings.reasons));
        }
        if (findings.unsupported) {
            throw HalException.unsupported(String.join("; ", findings.reasons));
        }
        if (!findings.reasons.isEmpty()) {
            throw HalException.invalidCircuit(String.join("; ", findings.reasons));
        }
        if (!findings.transpilation.isEmpty()) {
            throw HalException.invalidCircuit("requires transpilation: " + String.join("; ", findings.transpilation));
        }
    }

    private static Findings inspect(Capabilities capabilities, CircuitProfile profile) {
        Findings findings = new Findings();
        int deviceQubits = capabilities.numQubits();
        GateSet gateSet = capabilities.gateSet();
        Topology topology = capabilities.topology();
        boolean checkConnectivity = !(topology.kind() == TopologyKind.CUSTOM && topology.edges().isEmpty());

        if (profile.numQubits() > deviceQubits) {
            findings.tooLarge = true;
            findings.reasons.add("Circuit requires " + profile.numQubits()
                    + " qubits, backend has " + deviceQubits);
        }

        for (CircuitProfile.GateApplication application : profile.gates()) {
            String gate = application.gate().trim().toLowerCase(Locale.ROOT);
            boolean operandsInRange = true;
            for (int qubit : application.qubits()) {
                if (qubit < 0 || qubit >= deviceQubits) {
                    operandsInRange = false;
                    findings.reasons.add("Gate " + gate + " acts on qubit " + qubit
                            + ", backend qubits are 0.." + (deviceQubits - 1));
                }
            }

            int arity = gateSet.arityOf(gate);
            if (arity == 0) {
                findings.unsupported = true;
                findings.reasons.add("Unsupported gate: " + gate);
                continue;
            }
            if (!application.qubits().isEmpty() && arity != application.arity()) {
                findings.reasons.add("Gate " + gate + " acts on " + arity
                        + " qubits, applied to " + application.arity());
                continue;
            }
            if (!gateSet.isNative(gate)) {
                findings.transpilation.add("gate " + gate + " is not native");
            }
            if (checkConnectivity && operandsInRange && application.arity() >= 2) {
                List<Integer> qubits = application.qubits();
                for (int i = 0; i < qubits.size(); i++) {
                    for (int j = i + 1; j < qubits.size(); j++) {
                        int a = qubits.get(i);
                        int b = qubits.get(j);
                        if (!topology.isConnected(a, b)) {
                            findings.transpilation.add("qubits " + a + " and " + b + " are not connected");
                        }
                    }
                }
            }
        }
        return findings;
    }

    private static final class Findings {
        final Set<String> reasons = new LinkedHashSet<>();
        final Set<String> transpilation = new LinkedHashSet<>();
        boolean tooLarge;
        boolean unsupported;
    }
}
