package io.surfworks.qhal.config;

import io.surfworks.qhal.wait.RetryPolicy;
import io.surfworks.qhal.wait.WaitPolicy;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for qhal clients.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/qhal/qhal.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param defaultBackend  registry name of the backend used when none is given
 * @param waitPolicy      polling policy for waiting on jobs
 * @param retryPolicy     backoff for transient backend failures
 * @param simulatorQubits width of the built-in simulator
 */
public record HalConfig(
        String defaultBackend,
        WaitPolicy waitPolicy,
        RetryPolicy retryPolicy,
        int simulatorQubits
) {

    /** Default backend when none is configured */
    public static final String DEFAULT_BACKEND = "mock";

    /** Default width of the built-in simulator */
    public static final int DEFAULT_SIMULATOR_QUBITS = 20;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "qhal"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "qhal.json";

    public HalConfig {
        Objects.requireNonNull(defaultBackend, "defaultBackend cannot be null");
        Objects.requireNonNull(waitPolicy, "waitPolicy cannot be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");

        if (defaultBackend.isBlank()) {
            throw new IllegalArgumentException("defaultBackend cannot be blank");
        }
        if (simulatorQubits < 1) {
            throw new IllegalArgumentException("simulatorQubits must be positive");
        }
    }

    public static HalConfig defaults() {
        return new HalConfig(
                DEFAULT_BACKEND,
                WaitPolicy.defaults(),
                RetryPolicy.defaults(),
                DEFAULT_SIMULATOR_QUBITS
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public HalConfig withBackend(String backend) {
        return new HalConfig(backend, waitPolicy, retryPolicy, simulatorQubits);
    }

    public HalConfig withWaitPolicy(WaitPolicy policy) {
        return new HalConfig(defaultBackend, policy, retryPolicy, simulatorQubits);
    }

    public HalConfig withRetryPolicy(RetryPolicy policy) {
        return new HalConfig(defaultBackend, waitPolicy, policy, simulatorQubits);
    }

    public HalConfig withSimulatorQubits(int qubits) {
        return new HalConfig(defaultBackend, waitPolicy, retryPolicy, qubits);
    }
}
