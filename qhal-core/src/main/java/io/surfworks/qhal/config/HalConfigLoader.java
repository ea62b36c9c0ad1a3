package io.surfworks.qhal.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.qhal.wait.RetryPolicy;
import io.surfworks.qhal.wait.WaitPolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Loads and saves HalConfig.
 *
 * <p>A missing config file yields {@link HalConfig#defaults()}. A file that
 * cannot be parsed, or holds invalid values, is logged and also yields the
 * defaults. Fields absent from the file keep their default values.
 *
 * <p>File layout:
 * <pre>{@code
 * {
 *   "defaultBackend": "mock",
 *   "simulatorQubits": 20,
 *   "wait": { "pollIntervalMs": 500, "maxPolls": 600 },
 *   "retry": { "maxRetries": 3, "initialIntervalMs": 1000, "multiplier": 2.0, "maxIntervalMs": 60000 }
 * }
 * }</pre>
 */
public final class HalConfigLoader {

    private static final Logger LOG = Logger.getLogger(HalConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private HalConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static HalConfig load() {
        return load(HalConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static HalConfig load(Path configFile) {
        HalConfig config = HalConfig.defaults();
        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }
        return config;
    }

    /**
     * Saves configuration to the default config file.
     */
    public static void save(HalConfig config) throws IOException {
        save(config, HalConfig.configFile());
    }

    /**
     * Saves configuration to a specific file, creating parent directories.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(HalConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), toJson(config));
    }

    /**
     * Renders a configuration as the JSON tree written by {@link #save}.
     */
    public static ObjectNode toJson(HalConfig config) {
        ObjectNode root = JSON.createObjectNode();
        root.put("defaultBackend", config.defaultBackend());
        root.put("simulatorQubits", config.simulatorQubits());

        ObjectNode wait = root.putObject("wait");
        wait.put("pollIntervalMs", config.waitPolicy().pollInterval().toMillis());
        wait.put("maxPolls", config.waitPolicy().maxPolls());

        RetryPolicy retry = config.retryPolicy();
        ObjectNode retryNode = root.putObject("retry");
        retryNode.put("maxRetries", retry.maxRetries());
        retryNode.put("initialIntervalMs", retry.initialInterval().toMillis());
        retryNode.put("multiplier", retry.multiplier());
        retryNode.put("maxIntervalMs", retry.maxInterval().toMillis());
        return root;
    }

    private static HalConfig loadFromFile(Path configFile, HalConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning(() -> "Ignoring config " + configFile + ": expected a JSON object");
                return base;
            }

            HalConfig config = base
                    .withBackend(getStringOrDefault(root, "defaultBackend", base.defaultBackend()))
                    .withSimulatorQubits(root.path("simulatorQubits").asInt(base.simulatorQubits()));

            if (root.has("wait")) {
                JsonNode waitNode = root.get("wait");
                WaitPolicy wait = base.waitPolicy();
                config = config.withWaitPolicy(new WaitPolicy(
                        getMillisOrDefault(waitNode, "pollIntervalMs", wait.pollInterval()),
                        waitNode.path("maxPolls").asInt(wait.maxPolls())));
            }

            if (root.has("retry")) {
                JsonNode retryNode = root.get("retry");
                RetryPolicy retry = base.retryPolicy();
                config = config.withRetryPolicy(new RetryPolicy(
                        retryNode.path("maxRetries").asInt(retry.maxRetries()),
                        getMillisOrDefault(retryNode, "initialIntervalMs", retry.initialInterval()),
                        retryNode.path("multiplier").asDouble(retry.multiplier()),
                        getMillisOrDefault(retryNode, "maxIntervalMs", retry.maxInterval())));
            }

            return config;

        } catch (IOException | IllegalArgumentException e) {
            LOG.warning(() -> "Ignoring unreadable config " + configFile + ": " + e.getMessage());
            return base;
        }
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.has(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }

    private static Duration getMillisOrDefault(JsonNode node, String field, Duration defaultValue) {
        if (node.has(field)) {
            return Duration.ofMillis(node.get(field).asLong());
        }
        return defaultValue;
    }
}
