package io.surfworks.qhal.capability;

/**
 * Shape of a qubit connectivity graph.
 */
public enum TopologyKind {
    /** All-to-all */
    FULLY_CONNECTED,

    /** Linear chain */
    LINEAR,

    /** Center qubit connected to every other qubit */
    STAR,

    /** Rectangular grid (rows x cols) */
    GRID,

    /** Heavy-hex lattice (IBM Eagle/Heron) */
    HEAVY_HEX,

    /** Arbitrary edge list */
    CUSTOM,

    /** Neutral-atom array split into interaction zones */
    NEUTRAL_ATOM
}
