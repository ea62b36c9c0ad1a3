package io.surfworks.qhal.config;

import io.surfworks.qhal.wait.RetryPolicy;
import io.surfworks.qhal.wait.WaitPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HalConfig and HalConfigLoader.
 */
class HalConfigTest {

    @TempDir
    Path tempDir;

    // ===== HalConfig tests =====

    @Test
    void defaultsReturnsValidConfig() {
        HalConfig config = HalConfig.defaults();

        assertEquals("mock", config.defaultBackend());
        assertEquals(WaitPolicy.defaults(), config.waitPolicy());
        assertEquals(RetryPolicy.defaults(), config.retryPolicy());
        assertEquals(20, config.simulatorQubits());
    }

    @Test
    void withBackendCreatesNewInstance() {
        HalConfig base = HalConfig.defaults();
        HalConfig modified = base.withBackend("iqm");

        assertEquals("mock", base.defaultBackend());
        assertEquals("iqm", modified.defaultBackend());
    }

    @Test
    void blankBackendThrows() {
        assertThrows(IllegalArgumentException.class, () -> HalConfig.defaults().withBackend(" "));
    }

    @Test
    void nonPositiveSimulatorQubitsThrows() {
        assertThrows(IllegalArgumentException.class, () -> HalConfig.defaults().withSimulatorQubits(0));
    }

    @Test
    void configFileUnderConfigDir() {
        assertEquals(HalConfig.CONFIG_DIR.resolve("qhal.json"), HalConfig.configFile());
    }

    // ===== HalConfigLoader tests =====

    @Test
    void loadMissingFileReturnsDefaults() {
        assertEquals(HalConfig.defaults(), HalConfigLoader.load(tempDir.resolve("missing.json")));
    }

    @Test
    void saveAndLoadRoundTrip() throws IOException {
        Path configFile = tempDir.resolve("nested").resolve("qhal.json");
        HalConfig original = HalConfig.defaults()
                .withBackend("ionq")
                .withSimulatorQubits(12)
                .withWaitPolicy(new WaitPolicy(Duration.ofMillis(250), 40))
                .withRetryPolicy(new RetryPolicy(5, Duration.ofMillis(100), 3.0, Duration.ofSeconds(10)));

        HalConfigLoader.save(original, configFile);

        assertTrue(Files.exists(configFile));
        assertEquals(original, HalConfigLoader.load(configFile));
    }

    @Test
    void partialFileKeepsDefaults() throws IOException {
        Path configFile = tempDir.resolve("qhal.json");
        Files.writeString(configFile, "{\"defaultBackend\": \"rigetti\", \"wait\": {\"maxPolls\": 10}}");

        HalConfig config = HalConfigLoader.load(configFile);

        assertEquals("rigetti", config.defaultBackend());
        assertEquals(10, config.waitPolicy().maxPolls());
        assertEquals(Duration.ofMillis(500), config.waitPolicy().pollInterval());
        assertEquals(RetryPolicy.defaults(), config.retryPolicy());
    }

    @Test
    void malformedFileReturnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("qhal.json");
        Files.writeString(configFile, "{ not json");

        assertEquals(HalConfig.defaults(), HalConfigLoader.load(configFile));
    }

    @Test
    void invalidValuesReturnDefaults() throws IOException {
        Path configFile = tempDir.resolve("qhal.json");
        Files.writeString(configFile, "{\"simulatorQubits\": 0}");

        assertEquals(HalConfig.defaults(), HalConfigLoader.load(configFile));
    }

    @Test
    void nonObjectFileReturnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("qhal.json");
        Files.writeString(configFile, "[1, 2, 3]");

        assertEquals(HalConfig.defaults(), HalConfigLoader.load(configFile));
    }

    @Test
    void savedFileIsReadableJson() throws IOException {
        Path configFile = tempDir.resolve("qhal.json");
        HalConfigLoader.save(HalConfig.defaults(), configFile);

        String content = Files.readString(configFile);
        assertTrue(content.contains("\"defaultBackend\" : \"mock\""));
        assertTrue(content.contains("\"pollIntervalMs\" : 500"));
    }
}
