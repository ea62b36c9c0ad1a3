package io.surfworks.qhal.cli;

import io.surfworks.qhal.backend.Backend;
import io.surfworks.qhal.backend.BackendRegistry;
import io.surfworks.qhal.backend.ValidationResult;
import io.surfworks.qhal.capability.Capabilities;
import io.surfworks.qhal.capability.HardwarePreset;
import io.surfworks.qhal.config.HalConfig;
import io.surfworks.qhal.config.HalConfigLoader;
import io.surfworks.qhal.error.HalException;
import io.surfworks.qhal.job.JobId;
import io.surfworks.qhal.json.HalJson;
import io.surfworks.qhal.result.Counts;
import io.surfworks.qhal.result.ExecutionResult;
import io.surfworks.qhal.testing.MockBackend;
import io.surfworks.qhal.testing.MockCircuit;
import io.surfworks.qhal.wait.JobWaiter;
import io.surfworks.qhal.wait.Retrier;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * qhal CLI - inspect hardware presets and run circuits on the in-memory simulator.
 *
 * <p>Commands:
 * <ul>
 *   <li>presets - List hardware presets</li>
 *   <li>capabilities - Show the capabilities of a preset</li>
 *   <li>run - Submit a circuit and wait for its counts</li>
 *   <li>config - Show or initialize configuration</li>
 * </ul>
 */
public class QhalCli {

    static final String VERSION = "0.1.0";

    /** Registry name of the in-memory simulator */
    static final String MOCK_BACKEND = "mock";

    static {
        BackendRegistry.register(MOCK_BACKEND, MockCircuit.class, MockBackend::withCapabilities);
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printHelp(out);
            return 0;
        }

        String command = args[0];

        // Global flags only when they are the command itself
        if (command.equals("--help") || command.equals("-h")) {
            printHelp(out);
            return 0;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("qhal " + VERSION);
            return 0;
        }
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (command) {
                case "presets" -> handlePresets(commandArgs, out);
                case "capabilities" -> handleCapabilities(commandArgs, out);
                case "run" -> handleRun(commandArgs, out);
                case "config" -> handleConfig(commandArgs, out, err);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'qhal --help' for usage.");
                    yield 1;
                }
            };
        } catch (HalException e) {
            err.println("Backend error [" + e.kind() + "]: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static int handlePresets(String[] args, PrintStream out) {
        if (hasFlag(args, "--help")) {
            out.println("Usage: qhal presets");
            return 0;
        }
        out.printf("%-14s  %6s  %-16s  %s%n", "PRESET", "QUBITS", "TOPOLOGY", "NATIVE GATES");
        for (HardwarePreset preset : HardwarePreset.values()) {
            Capabilities caps = preset.create();
            List<String> nativeGates = caps.gateSet().nativeGates();
            out.printf("%-14s  %6d  %-16s  %s%n",
                    preset.id(),
                    caps.numQubits(),
                    caps.topology().kind(),
                    nativeGates.isEmpty() ? "(all)" : String.join(",", nativeGates));
        }
        return 0;
    }

    private static int handleCapabilities(String[] args, PrintStream out) {
        if (args.length == 0 || hasFlag(args, "--help")) {
            out.println("Usage: qhal capabilities <preset> [qubits]");
            return args.length == 0 ? 1 : 0;
        }

        HardwarePreset preset = HardwarePreset.fromId(args[0]);
        Capabilities caps = args.length > 1 ? preset.create(parsePositive(args[1], "qubits")) : preset.create();
        out.println(HalJson.pretty(HalJson.toJson(caps)));
        return 0;
    }

    private static int handleRun(String[] args, PrintStream out) throws HalException, IOException {
        if (hasFlag(args, "--help")) {
            printRunHelp(out);
            return 0;
        }

        HalConfig config = HalConfigLoader.load(configPath(args));

        String backendName = getFlagValue(args, "--backend");
        String presetId = getFlagValue(args, "--preset");
        String qubitsStr = getFlagValue(args, "--qubits");
        String shotsStr = getFlagValue(args, "--shots");
        String gatesStr = getFlagValue(args, "--gates");
        boolean json = hasFlag(args, "--json");

        HardwarePreset preset = presetId != null ? HardwarePreset.fromId(presetId) : HardwarePreset.SIMULATOR;
        int deviceQubits = preset == HardwarePreset.SIMULATOR ? config.simulatorQubits() : preset.defaultQubits();
        int circuitQubits = qubitsStr != null ? parsePositive(qubitsStr, "qubits") : 2;
        int shots = shotsStr != null ? Integer.parseInt(shotsStr) : 1024;

        Capabilities caps = preset.create(deviceQubits);
        MockCircuit circuit = GateSpec.parse(gatesStr != null ? gatesStr : "h,cx", circuitQubits, caps.gateSet());

        try (Backend<MockCircuit> backend = getBackend(backendName, config, caps)) {
            ValidationResult validation = backend.validate(circuit);
            if (validation.requiresTranspilation() && !json) {
                out.println("Note: circuit needs transpilation: " + validation.transpilationDetails());
            }

            Retrier retrier = new Retrier(config.retryPolicy());
            JobId jobId = retrier.call(() -> backend.submit(circuit, shots));
            ExecutionResult result = new JobWaiter(config.waitPolicy()).await(backend, jobId);

            if (json) {
                out.println(HalJson.pretty(HalJson.toJson(result)));
            } else {
                printResult(jobId, result, out);
            }
        }
        return 0;
    }

    private static int handleConfig(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: qhal config [show|init] [--config <path>]");
            out.println();
            out.println("  show    Show the effective configuration (default)");
            out.println("  init    Write the default configuration if no file exists");
            return 0;
        }

        Path path = configPath(args);
        String action = args.length > 0 && !args[0].startsWith("--") ? args[0] : "show";

        switch (action) {
            case "show" -> {
                HalConfig config = HalConfigLoader.load(path);
                out.println("Config file: " + path + (Files.exists(path) ? "" : " (not found, using defaults)"));
                out.println(HalJson.pretty(HalConfigLoader.toJson(config)));
                return 0;
            }
            case "init" -> {
                if (Files.exists(path)) {
                    err.println("Config file already exists: " + path);
                    return 1;
                }
                HalConfigLoader.save(HalConfig.defaults(), path);
                out.println("Wrote " + path);
                return 0;
            }
            default -> {
                err.println("Unknown config action: " + action);
                return 1;
            }
        }
    }

    private static void printResult(JobId jobId, ExecutionResult result, PrintStream out) {
        out.println("Job Result");
        out.println("-".repeat(40));
        out.println("Job ID: " + jobId);
        out.println("Shots: " + result.shots());
        out.println("Execution Time: " + formatDuration(result.executionTime()));
        Counts counts = result.counts();
        for (Counts.Outcome outcome : counts.sorted()) {
            out.printf("  %s  %d%n", outcome.bitstring(), outcome.count());
        }
        result.mostFrequent().ifPresent(top ->
                out.printf("Most frequent: %s (%.1f%%)%n", top.bitstring(), top.probability() * 100));
    }

    private static String formatDuration(Duration duration) {
        if (duration == null) return "-";
        return duration.toMillis() + "ms";
    }

    // ===== Helper methods =====

    private static Backend<MockCircuit> getBackend(String name, HalConfig config, Capabilities caps)
            throws HalException {
        String backendName = name != null ? name : config.defaultBackend();
        return BackendRegistry.create(backendName, MockCircuit.class, caps);
    }

    private static Path configPath(String[] args) {
        String override = getFlagValue(args, "--config");
        return override != null ? Path.of(override) : HalConfig.configFile();
    }

    private static int parsePositive(String value, String what) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(what + " must be an integer, got " + value, e);
        }
        if (n < 1) {
            throw new IllegalArgumentException(what + " must be positive, got " + n);
        }
        return n;
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    // ===== Help output =====

    private static void printHelp(PrintStream out) {
        out.println("qhal - Quantum backend contract tool");
        out.println();
        out.println("Usage: qhal <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  presets       List hardware presets");
        out.println("  capabilities  Show the capabilities of a preset as JSON");
        out.println("  run           Run a circuit on the in-memory simulator");
        out.println("  config        Show or initialize configuration");
        out.println();
        out.println("Options:");
        out.println("  -h, --help    Show help for a command");
        out.println("  -v, --version Show version");
        out.println();
        out.println("Examples:");
        out.println("  qhal capabilities iqm 5");
        out.println("  qhal run --qubits 2 --shots 1000 --gates h,cx");
        out.println("  qhal run --preset ionq --gates 'rx:0,xx:0:1' --json");
    }

    private static void printRunHelp(PrintStream out) {
        out.println("Usage: qhal run [options]");
        out.println();
        out.println("Submit a circuit to an in-memory backend and print its counts.");
        out.println();
        out.println("Options:");
        out.println("  --backend <name>   Registered backend to run on (default: from config)");
        out.println("  --preset <id>      Hardware preset to emulate (default: simulator)");
        out.println("  --qubits <n>       Circuit width (default: 2)");
        out.println("  --shots <n>        Shots to run (default: 1024)");
        out.println("  --gates <list>     Comma-separated gates, each name[:q0[:q1...]] (default: h,cx)");
        out.println("  --config <path>    Config file to use");
        out.println("  --json             Output as JSON");
        out.println();
        out.println("Gates without operands act on qubits 0..arity-1.");
    }
}
