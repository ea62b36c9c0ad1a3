package io.surfworks.qhal.capability;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Qubit connectivity topology.
 *
 * <p>Edges are undirected: if {@code (a, b)} is listed, both {@code a -> b}
 * and {@code b -> a} are valid two-qubit interactions.
 *
 * @param kind  Shape of the graph
 * @param edges Coupling edges over qubit indices
 * @param rows  Grid rows (GRID only, otherwise 0)
 * @param cols  Grid columns (GRID only, otherwise 0)
 * @param zones Interaction zones (NEUTRAL_ATOM only, otherwise 0)
 */
public record Topology(
        TopologyKind kind,
        List<Edge> edges,
        int rows,
        int cols,
        int zones
) {

    /**
     * An undirected coupling between two qubits.
     */
    public record Edge(int a, int b) {
        public Edge {
            if (a < 0 || b < 0) {
                throw new IllegalArgumentException("qubit indices cannot be negative: (" + a + ", " + b + ")");
            }
        }

        public boolean connects(int q1, int q2) {
            return (a == q1 && b == q2) || (a == q2 && b == q1);
        }
    }

    public Topology {
        Objects.requireNonNull(kind, "kind cannot be null");
        edges = edges == null ? List.of() : List.copyOf(edges);
        if (rows < 0 || cols < 0 || zones < 0) {
            throw new IllegalArgumentException("rows, cols and zones cannot be negative");
        }
    }

    /**
     * Linear chain 0-1-2-...-(n-1).
     */
    public static Topology linear(int n) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i + 1 < n; i++) {
            edges.add(new Edge(i, i + 1));
        }
        return new Topology(TopologyKind.LINEAR, edges, 0, 0, 0);
    }

    /**
     * Star with qubit 0 at the center.
     */
    public static Topology star(int n) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 1; i < n; i++) {
            edges.add(new Edge(0, i));
        }
        return new Topology(TopologyKind.STAR, edges, 0, 0, 0);
    }

    /**
     * Fully connected graph over n qubits.
     */
    public static Topology full(int n) {
        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                edges.add(new Edge(i, j));
            }
        }
        return new Topology(TopologyKind.FULLY_CONNECTED, edges, 0, 0, 0);
    }

    /**
     * Rectangular grid. Node {@code (r, c)} has index {@code r * cols + c} and is
     * connected to its right and down neighbours only (no wraparound).
     */
    public static Topology grid(int rows, int cols) {
        List<Edge> edges = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int idx = r * cols + c;
                if (c + 1 < cols) {
                    edges.add(new Edge(idx, idx + 1));
                }
                if (r + 1 < rows) {
                    edges.add(new Edge(idx, idx + cols));
                }
            }
        }
        return new Topology(TopologyKind.GRID, edges, rows, cols, 0);
    }

    /**
     * Arbitrary edge list.
     */
    public static Topology custom(List<Edge> edges) {
        return new Topology(TopologyKind.CUSTOM, edges, 0, 0, 0);
    }

    /**
     * Neutral-atom array. Qubits within a zone are fully connected; crossing
     * zones requires shuttling. The last zone takes any remainder.
     */
    public static Topology neutralAtom(int numQubits, int zones) {
        int perZone = numQubits / Math.max(zones, 1);
        List<Edge> edges = new ArrayList<>();
        for (int z = 0; z < zones; z++) {
            int start = z * perZone;
            int end = z == zones - 1 ? numQubits : start + perZone;
            for (int i = start; i < end; i++) {
                for (int j = i + 1; j < end; j++) {
                    edges.add(new Edge(i, j));
                }
            }
        }
        return new Topology(TopologyKind.NEUTRAL_ATOM, edges, 0, 0, zones);
    }

    /**
     * Returns true if the two qubits share an edge, in either orientation.
     */
    public boolean isConnected(int q1, int q2) {
        for (Edge edge : edges) {
            if (edge.connects(q1, q2)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the highest qubit index referenced by an edge, or -1 if there are none.
     */
    public int maxQubitIndex() {
        int max = -1;
        for (Edge edge : edges) {
            max = Math.max(max, Math.max(edge.a(), edge.b()));
        }
        return max;
    }
}
