package io.surfworks.qhal.capability;

import java.util.Locale;

/**
 * Named reference configurations for common hardware families.
 */
public enum HardwarePreset {
    SIMULATOR("simulator", 20),
    IQM("iqm", 20),
    IBM_EAGLE("ibm-eagle", 127),
    IBM_HERON("ibm-heron", 156),
    RIGETTI("rigetti", 84),
    IONQ("ionq", 36),
    NEUTRAL_ATOM("neutral-atom", 100);

    /** Zone count used when building the neutral-atom preset */
    public static final int DEFAULT_ZONES = 2;

    private final String id;
    private final int defaultQubits;

    HardwarePreset(String id, int defaultQubits) {
        this.id = id;
        this.defaultQubits = defaultQubits;
    }

    public String id() {
        return id;
    }

    public int defaultQubits() {
        return defaultQubits;
    }

    /**
     * Builds capabilities with the preset's default qubit count.
     */
    public Capabilities create() {
        return create(defaultQubits);
    }

    /**
     * Builds capabilities for a device of the given size.
     */
    public Capabilities create(int numQubits) {
        return switch (this) {
            case SIMULATOR -> Capabilities.simulator(numQubits);
            case IQM -> Capabilities.iqm(id, numQubits);
            case IBM_EAGLE -> Capabilities.ibmEagle(id, numQubits);
            case IBM_HERON -> Capabilities.ibmHeron(id, numQubits);
            case RIGETTI -> Capabilities.rigetti(id, numQubits);
            case IONQ -> Capabilities.ionq(id, numQubits);
            case NEUTRAL_ATOM -> Capabilities.neutralAtom(id, numQubits, DEFAULT_ZONES);
        };
    }

    /**
     * Looks up a preset by id ("ibm-heron") or constant name ("IBM_HERON").
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static HardwarePreset fromId(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (HardwarePreset preset : values()) {
            if (preset.id.equals(normalized)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("Unknown hardware preset: " + value);
    }
}
