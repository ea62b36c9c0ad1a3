package io.surfworks.qhal.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.surfworks.qhal.backend.BackendAvailability;
import io.surfworks.qhal.capability.Capabilities;
import io.surfworks.qhal.capability.GateSet;
import io.surfworks.qhal.capability.NoiseProfile;
import io.surfworks.qhal.capability.Topology;
import io.surfworks.qhal.capability.TopologyKind;
import io.surfworks.qhal.result.Counts;
import io.surfworks.qhal.result.ExecutionResult;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON encoding of the contract's value types.
 *
 * <p>Field names are snake_case ({@code num_qubits}, {@code gate_set},
 * {@code is_simulator}, ...). Absent optional values are omitted rather than
 * written as null. Topology edges are written as {@code [[a, b], ...]} and the
 * topology kind as a lowercase name ({@code fully_connected}, {@code grid}).
 *
 * <p>Capabilities and ExecutionResult can be read back; a document of the
 * wrong shape fails with an {@link IOException}.
 */
public final class HalJson {

    // java.time metadata values are written as ISO-8601 strings
    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private HalJson() {
    }

    // ===== Writing =====

    public static ObjectNode toJson(Capabilities caps) {
        ObjectNode root = JSON.createObjectNode();
        root.put("name", caps.name());
        root.put("num_qubits", caps.numQubits());
        root.set("gate_set", toJson(caps.gateSet()));
        root.set("topology", toJson(caps.topology()));
        root.put("max_shots", caps.maxShots());
        root.put("is_simulator", caps.simulator());
        if (!caps.features().isEmpty()) {
            ArrayNode features = root.putArray("features");
            caps.features().forEach(features::add);
        }
        if (caps.noiseProfile() != null) {
            root.set("noise_profile", toJson(caps.noiseProfile()));
        }
        return root;
    }

    public static ObjectNode toJson(GateSet gates) {
        ObjectNode node = JSON.createObjectNode();
        putStrings(node, "single_qubit", gates.singleQubit());
        putStrings(node, "two_qubit", gates.twoQubit());
        if (!gates.threeQubit().isEmpty()) {
            putStrings(node, "three_qubit", gates.threeQubit());
        }
        putStrings(node, "native", gates.nativeGates());
        return node;
    }

    public static ObjectNode toJson(Topology topology) {
        ObjectNode node = JSON.createObjectNode();
        node.put("kind", topology.kind().name().toLowerCase(Locale.ROOT));
        if (topology.kind() == TopologyKind.GRID) {
            node.put("rows", topology.rows());
            node.put("cols", topology.cols());
        }
        if (topology.kind() == TopologyKind.NEUTRAL_ATOM) {
            node.put("zones", topology.zones());
        }
        ArrayNode edges = node.putArray("edges");
        for (Topology.Edge edge : topology.edges()) {
            edges.addArray().add(edge.a()).add(edge.b());
        }
        return node;
    }

    public static ObjectNode toJson(NoiseProfile noise) {
        ObjectNode node = JSON.createObjectNode();
        putIfKnown(node, "t1", noise.t1());
        putIfKnown(node, "t2", noise.t2());
        putIfKnown(node, "single_qubit_fidelity", noise.singleQubitFidelity());
        putIfKnown(node, "two_qubit_fidelity", noise.twoQubitFidelity());
        putIfKnown(node, "readout_fidelity", noise.readoutFidelity());
        putIfKnown(node, "gate_time", noise.gateTime());
        return node;
    }

    public static ObjectNode toJson(BackendAvailability availability) {
        ObjectNode node = JSON.createObjectNode();
        node.put("is_available", availability.available());
        availability.queueDepthIfKnown().ifPresent(depth -> node.put("queue_depth", depth));
        availability.estimatedWaitIfKnown().ifPresent(secs -> node.put("estimated_wait_secs", secs));
        availability.statusMessageIfPresent().ifPresent(msg -> node.put("status_message", msg));
        return node;
    }

    /**
     * Counts as an object of bitstring to count, in bitstring order.
     */
    public static ObjectNode toJson(Counts counts) {
        ObjectNode node = JSON.createObjectNode();
        for (Map.Entry<String, Long> entry : counts.asMap().entrySet()) {
            node.put(entry.getKey(), entry.getValue().longValue());
        }
        return node;
    }

    public static ObjectNode toJson(ExecutionResult result) {
        ObjectNode node = JSON.createObjectNode();
        node.set("counts", toJson(result.counts()));
        node.put("shots", result.shots());
        result.executionTimeIfKnown().ifPresent(time -> node.put("execution_time_ms", time.toMillis()));
        node.set("metadata", JSON.valueToTree(result.metadata()));
        return node;
    }

    /**
     * Renders a tree as indented JSON text.
     */
    public static String pretty(JsonNode node) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (IOException e) {
            // Trees built from JsonNodeFactory always serialize
            throw new IllegalStateException("Failed to render JSON", e);
        }
    }

    // ===== Reading =====

    public static Capabilities readCapabilities(String json) throws IOException {
        return capabilitiesFromJson(JSON.readTree(json));
    }

    public static ExecutionResult readExecutionResult(String json) throws IOException {
        return executionResultFromJson(JSON.readTree(json));
    }

    public static Capabilities capabilitiesFromJson(JsonNode root) throws IOException {
        requireObject(root, "capabilities");
        try {
            NoiseProfile noise = root.has("noise_profile") ? noiseFromJson(root.get("noise_profile")) : null;
            return new Capabilities(
                    requireField(root, "name").asText(),
                    requireField(root, "num_qubits").asInt(),
                    gateSetFromJson(requireField(root, "gate_set")),
                    topologyFromJson(requireField(root, "topology")),
                    requireField(root, "max_shots").asInt(),
                    root.path("is_simulator").asBoolean(false),
                    readStrings(root.path("features")),
                    noise
            );
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid capabilities: " + e.getMessage(), e);
        }
    }

    public static ExecutionResult executionResultFromJson(JsonNode root) throws IOException {
        requireObject(root, "execution result");
        try {
            Counts counts = countsFromJson(requireField(root, "counts"));
            Duration time = root.has("execution_time_ms")
                    ? Duration.ofMillis(root.get("execution_time_ms").asLong())
                    : null;
            JsonNode metadataNode = root.path("metadata");
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (metadataNode.isObject()) {
                metadata.putAll(JSON.convertValue(metadataNode, METADATA_TYPE));
            }
            return new ExecutionResult(counts, requireField(root, "shots").asInt(), time, metadata);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid execution result: " + e.getMessage(), e);
        }
    }

    public static Counts countsFromJson(JsonNode node) throws IOException {
        requireObject(node, "counts");
        Counts counts = new Counts();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isIntegralNumber() || !value.canConvertToLong()) {
                throw new IOException("Count for " + field.getKey() + " is not an integer");
            }
            try {
                counts.insert(field.getKey(), value.asLong());
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid counts: " + e.getMessage(), e);
            }
        }
        return counts;
    }

    private static GateSet gateSetFromJson(JsonNode node) throws IOException {
        requireObject(node, "gate_set");
        return new GateSet(
                readStrings(node.path("single_qubit")),
                readStrings(node.path("two_qubit")),
                readStrings(node.path("three_qubit")),
                readStrings(node.path("native")));
    }

    private static Topology topologyFromJson(JsonNode node) throws IOException {
        requireObject(node, "topology");
        String kindName = requireField(node, "kind").asText().toUpperCase(Locale.ROOT);
        TopologyKind kind;
        try {
            kind = TopologyKind.valueOf(kindName);
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown topology kind: " + node.get("kind").asText(), e);
        }

        List<Topology.Edge> edges = new ArrayList<>();
        for (JsonNode pair : node.path("edges")) {
            if (!pair.isArray() || pair.size() != 2) {
                throw new IOException("Topology edge must be a pair, got " + pair);
            }
            edges.add(new Topology.Edge(pair.get(0).asInt(), pair.get(1).asInt()));
        }
        return new Topology(kind, edges, node.path("rows").asInt(0), node.path("cols").asInt(0),
                node.path("zones").asInt(0));
    }

    private static NoiseProfile noiseFromJson(JsonNode node) throws IOException {
        requireObject(node, "noise_profile");
        return new NoiseProfile(
                readDouble(node, "t1"),
                readDouble(node, "t2"),
                readDouble(node, "single_qubit_fidelity"),
                readDouble(node, "two_qubit_fidelity"),
                readDouble(node, "readout_fidelity"),
                readDouble(node, "gate_time"));
    }

    private static void putStrings(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        values.forEach(array::add);
    }

    private static void putIfKnown(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static List<String> readStrings(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }

    private static Double readDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asDouble();
    }

    private static JsonNode requireField(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Missing field: " + field);
        }
        return value;
    }

    private static void requireObject(JsonNode node, String what) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Expected a JSON object for " + what);
        }
    }
}
