package io.surfworks.qhal.capability;

/**
 * Device-wide noise averages reported by a backend.
 *
 * <p>Fidelities are in {@code [0, 1]} where 1 means perfect. Times are in
 * microseconds. A null component means "unknown", never zero.
 *
 * @param t1                  T1 relaxation time (device average, microseconds)
 * @param t2                  T2 dephasing time (device average, microseconds)
 * @param singleQubitFidelity Average single-qubit gate fidelity
 * @param twoQubitFidelity    Average two-qubit gate fidelity
 * @param readoutFidelity     Average readout fidelity
 * @param gateTime            Average gate execution time (microseconds)
 */
public record NoiseProfile(
        Double t1,
        Double t2,
        Double singleQubitFidelity,
        Double twoQubitFidelity,
        Double readoutFidelity,
        Double gateTime
) {

    public NoiseProfile {
        requireNonNegative(t1, "t1");
        requireNonNegative(t2, "t2");
        requireFidelity(singleQubitFidelity, "singleQubitFidelity");
        requireFidelity(twoQubitFidelity, "twoQubitFidelity");
        requireFidelity(readoutFidelity, "readoutFidelity");
        requireNonNegative(gateTime, "gateTime");
    }

    /**
     * Returns a profile where every figure is unknown.
     */
    public static NoiseProfile unknown() {
        return new NoiseProfile(null, null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns true if no figure is known.
     */
    public boolean isEmpty() {
        return t1 == null && t2 == null && singleQubitFidelity == null
                && twoQubitFidelity == null && readoutFidelity == null && gateTime == null;
    }

    private static void requireFidelity(Double value, String field) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new IllegalArgumentException(field + " must be in [0, 1], got " + value);
        }
    }

    private static void requireNonNegative(Double value, String field) {
        if (value != null && (value.isNaN() || value < 0.0)) {
            throw new IllegalArgumentException(field + " cannot be negative, got " + value);
        }
    }

    public static final class Builder {
        private Double t1;
        private Double t2;
        private Double singleQubitFidelity;
        private Double twoQubitFidelity;
        private Double readoutFidelity;
        private Double gateTime;

        private Builder() {
        }

        public Builder t1(double micros) {
            this.t1 = micros;
            return this;
        }

        public Builder t2(double micros) {
            this.t2 = micros;
            return this;
        }

        public Builder singleQubitFidelity(double fidelity) {
            this.singleQubitFidelity = fidelity;
            return this;
        }

        public Builder twoQubitFidelity(double fidelity) {
            this.twoQubitFidelity = fidelity;
            return this;
        }

        public Builder readoutFidelity(double fidelity) {
            this.readoutFidelity = fidelity;
            return this;
        }

        public Builder gateTime(double micros) {
            this.gateTime = micros;
            return this;
        }

        public NoiseProfile build() {
            return new NoiseProfile(t1, t2, singleQubitFidelity, twoQubitFidelity, readoutFidelity, gateTime);
        }
    }
}
