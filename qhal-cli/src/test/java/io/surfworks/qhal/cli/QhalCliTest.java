package io.surfworks.qhal.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the qhal command line.
 */
class QhalCliTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return QhalCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private String configArg() {
        return tempDir.resolve("qhal.json").toString();
    }

    // ===== Global flag tests =====

    @Test
    void noArgsPrintsHelp() {
        assertEquals(0, run());
        assertTrue(stdout().contains("Usage: qhal <command>"));
    }

    @Test
    void versionFlag() {
        assertEquals(0, run("--version"));
        assertEquals("qhal " + QhalCli.VERSION, stdout().trim());
    }

    @Test
    void unknownCommandFails() {
        assertEquals(1, run("teleport"));
        assertTrue(stderr().contains("Unknown command: teleport"));
    }

    // ===== presets / capabilities tests =====

    @Test
    void presetsListsEveryPreset() {
        assertEquals(0, run("presets"));
        String output = stdout();
        assertTrue(output.contains("ibm-heron"));
        assertTrue(output.contains("neutral-atom"));
        assertTrue(output.contains("STAR"));
    }

    @Test
    void capabilitiesPrintsJson() throws IOException {
        assertEquals(0, run("capabilities", "iqm", "5"));

        JsonNode json = JSON.readTree(stdout());
        assertEquals("iqm", json.get("name").asText());
        assertEquals(5, json.get("num_qubits").asInt());
        assertEquals("star", json.get("topology").get("kind").asText());
    }

    @Test
    void capabilitiesRejectsUnknownPreset() {
        assertEquals(1, run("capabilities", "dwave"));
        assertTrue(stderr().contains("Unknown hardware preset: dwave"));
    }

    // ===== run tests =====

    @Test
    void runBellCircuit() {
        assertEquals(0, run("run", "--shots", "100", "--config", configArg()));

        String output = stdout();
        assertTrue(output.contains("Shots: 100"));
        assertTrue(output.contains("00  50"));
        assertTrue(output.contains("11  50"));
    }

    @Test
    void runJsonOutput() throws IOException {
        assertEquals(0, run("run", "--qubits", "3", "--gates", "h:0,cx:0:1,cx:1:2", "--shots", "10",
                "--json", "--config", configArg()));

        JsonNode json = JSON.readTree(stdout());
        assertEquals(10, json.get("shots").asInt());
        assertEquals(5, json.get("counts").get("000").asInt());
        assertEquals(5, json.get("counts").get("111").asInt());
    }

    @Test
    void runOnPresetWithNativeGates() {
        assertEquals(0, run("run", "--preset", "ionq", "--gates", "rx:0,xx:0:1", "--shots", "4",
                "--config", configArg()));
    }

    @Test
    void runRejectsInvalidShots() {
        assertEquals(1, run("run", "--shots", "0", "--config", configArg()));
        assertTrue(stderr().contains("[INVALID_SHOTS]"));
    }

    @Test
    void runRejectsUnsupportedGate() {
        assertEquals(1, run("run", "--preset", "iqm", "--config", configArg()));
        assertTrue(stderr().contains("[UNSUPPORTED]"));
    }

    @Test
    void runRejectsBadQubitIndex() {
        assertEquals(1, run("run", "--gates", "h:x", "--config", configArg()));
        assertTrue(stderr().contains("Invalid qubit index"));
    }

    @Test
    void runOnNamedBackend() {
        assertEquals(0, run("run", "--backend", "MOCK", "--shots", "10", "--config", configArg()));
        assertTrue(stdout().contains("Job ID: mock-job-"));
    }

    @Test
    void runRejectsUnregisteredBackend() {
        assertEquals(1, run("run", "--backend", "ionq-cloud", "--config", configArg()));
        assertTrue(stderr().contains("[CONFIGURATION]"));
        assertTrue(stderr().contains("Available: [mock]"));
    }

    @Test
    void runUsesConfiguredDefaultBackend() throws IOException {
        Files.writeString(tempDir.resolve("qhal.json"), "{\"defaultBackend\": \"braket\"}");

        assertEquals(1, run("run", "--config", configArg()));
        assertTrue(stderr().contains("Backend 'braket' not registered"));

        assertEquals(0, run("run", "--backend", "mock", "--config", configArg()));
    }

    // ===== config tests =====

    @Test
    void configShowWithoutFileUsesDefaults() {
        assertEquals(0, run("config", "show", "--config", configArg()));
        assertTrue(stdout().contains("not found, using defaults"));
        assertTrue(stdout().contains("\"defaultBackend\" : \"mock\""));
    }

    @Test
    void configInitWritesFileOnce() {
        assertEquals(0, run("config", "init", "--config", configArg()));
        assertTrue(Files.exists(tempDir.resolve("qhal.json")));

        assertEquals(1, run("config", "init", "--config", configArg()));
        assertTrue(stderr().contains("already exists"));
    }

    @Test
    void configDefaultActionIsShow() throws IOException {
        Files.writeString(tempDir.resolve("qhal.json"), "{\"simulatorQubits\": 7}");

        assertEquals(0, run("config", "--config", configArg()));
        assertTrue(stdout().contains("\"simulatorQubits\" : 7"));
    }
}
