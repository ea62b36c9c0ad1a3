package io.surfworks.qhal.capability;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Capabilities, NoiseProfile and HardwarePreset.
 */
class CapabilitiesTest {

    // ===== Capabilities tests =====

    @Test
    void simulatorPreset() {
        Capabilities caps = Capabilities.simulator(5);

        assertEquals("simulator", caps.name());
        assertEquals(5, caps.numQubits());
        assertEquals(100_000, caps.maxShots());
        assertTrue(caps.simulator());
        assertEquals(TopologyKind.FULLY_CONNECTED, caps.topology().kind());
        assertTrue(caps.hasFeature("statevector"));
        assertTrue(caps.hasFeature("unitary"));
        assertNull(caps.noiseProfile());
    }

    @Test
    void iqmPreset() {
        Capabilities caps = Capabilities.iqm("garnet", 20);

        assertEquals(20_000, caps.maxShots());
        assertFalse(caps.simulator());
        assertEquals(TopologyKind.STAR, caps.topology().kind());
        assertTrue(caps.gateSet().isNative("cz"));
    }

    @Test
    void ibmPresetsHaveUnknownCouplingMap() {
        Capabilities eagle = Capabilities.ibmEagle("ibm_brussels", 127);
        Capabilities heron = Capabilities.ibmHeron("ibm_torino", 133);

        assertEquals(TopologyKind.CUSTOM, eagle.topology().kind());
        assertTrue(eagle.topology().edges().isEmpty());
        assertTrue(eagle.hasFeature("dynamic_circuits"));
        assertTrue(heron.gateSet().isNative("cz"));
    }

    @Test
    void rigettiUsesSmallestSquareGrid() {
        Capabilities caps = Capabilities.rigetti("ankaa", 10);

        assertEquals(4, caps.topology().rows());
        assertEquals(4, caps.topology().cols());
    }

    @Test
    void neutralAtomPreset() {
        Capabilities caps = Capabilities.neutralAtom("planqc", 10, 2);

        assertEquals(2, caps.topology().zones());
        assertTrue(caps.hasFeature("shuttling"));
        assertTrue(caps.hasFeature("zoned"));
    }

    @Test
    void withTopologyReturnsCopy() {
        Capabilities base = Capabilities.ibmEagle("ibm_brussels", 3);
        Capabilities linked = base.withTopology(Topology.linear(3));

        assertTrue(base.topology().edges().isEmpty());
        assertTrue(linked.topology().isConnected(1, 2));
        assertEquals(base.name(), linked.name());
    }

    @Test
    void withNoiseProfileReturnsCopy() {
        NoiseProfile noise = NoiseProfile.builder().t1(100.0).twoQubitFidelity(0.99).build();
        Capabilities caps = Capabilities.iqm("garnet", 20).withNoiseProfile(noise);

        assertSame(noise, caps.noiseProfile());
        assertEquals(0.99, caps.noiseProfile().twoQubitFidelity().doubleValue());
    }

    @Test
    void acceptsShotsWithinLimit() {
        Capabilities caps = Capabilities.simulator(2).withMaxShots(1000);

        assertTrue(caps.acceptsShots(1));
        assertTrue(caps.acceptsShots(1000));
        assertFalse(caps.acceptsShots(0));
        assertFalse(caps.acceptsShots(1001));
    }

    @Test
    void featuresAreImmutable() {
        Capabilities caps = Capabilities.simulator(2);
        assertThrows(UnsupportedOperationException.class, () -> caps.features().add("x"));
    }

    @Test
    void invalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> Capabilities.simulator(2).withMaxShots(0));
        assertThrows(IllegalArgumentException.class, () -> new Capabilities(
                "x", -1, GateSet.universal(), Topology.full(0), 10, true, List.of(), null));
    }

    // ===== NoiseProfile tests =====

    @Test
    void unknownNoiseProfileIsEmpty() {
        assertTrue(NoiseProfile.unknown().isEmpty());
        assertFalse(NoiseProfile.builder().gateTime(0.05).build().isEmpty());
    }

    @Test
    void fidelityOutOfRangeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> NoiseProfile.builder().readoutFidelity(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> NoiseProfile.builder().t2(-1.0).build());
    }

    // ===== HardwarePreset tests =====

    @Test
    void presetLookupByIdOrName() {
        assertEquals(HardwarePreset.IBM_HERON, HardwarePreset.fromId("ibm-heron"));
        assertEquals(HardwarePreset.IBM_HERON, HardwarePreset.fromId("IBM_HERON"));
        assertThrows(IllegalArgumentException.class, () -> HardwarePreset.fromId("dwave"));
    }

    @Test
    void presetCreatesCapabilities() {
        Capabilities ionq = HardwarePreset.IONQ.create();
        Capabilities small = HardwarePreset.NEUTRAL_ATOM.create(8);

        assertEquals("ionq", ionq.name());
        assertEquals(36, ionq.numQubits());
        assertEquals(8, small.numQubits());
        assertEquals(HardwarePreset.DEFAULT_ZONES, small.topology().zones());
    }
}
