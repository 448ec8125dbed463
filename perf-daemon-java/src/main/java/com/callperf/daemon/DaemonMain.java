package com.callperf.daemon;

import com.callperf.daemon.store.DataDirLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the sampler daemon.
 *
 * Usage:
 *   java -jar perf-daemon-java.jar start  [--config <daemon.json>] [--data-dir <dir>]
 *   java -jar perf-daemon-java.jar stop   [--config <daemon.json>] [--data-dir <dir>]
 *   java -jar perf-daemon-java.jar status [--config <daemon.json>] [--data-dir <dir>]
 *
 * {@code start} runs in the foreground until the process receives SIGTERM or SIGINT.
 */
public class DaemonMain {

    private static final Logger log = LoggerFactory.getLogger(DaemonMain.class);

    private static final long STOP_TIMEOUT_SECONDS = 60;

    enum Action { START, STOP, STATUS }

    record Command(Action action, Path configPath, Path dataDir) {}

    public static void main(String[] args) {
        try {
            System.exit(run(parse(args)));
        } catch (UsageException e) {
            System.err.println("[callperf-daemon] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar perf-daemon-java.jar start|stop|status "
                + "[--config <path>] [--data-dir <dir>]");
            System.exit(2);
        } catch (Exception e) {
            log.error("Sampler daemon failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static Command parse(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        Action action = switch (args[0]) {
            case "start" -> Action.START;
            case "stop" -> Action.STOP;
            case "status" -> Action.STATUS;
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        };

        String configPath = null;
        String dataDir = null;
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config"   -> configPath = requireNext(args, i++, "--config");
                case "--data-dir" -> dataDir    = requireNext(args, i++, "--data-dir");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        return new Command(action,
            configPath != null ? Paths.get(configPath) : null,
            dataDir != null ? Paths.get(dataDir) : null);
    }

    /** Loads the config file if given; an explicit data dir overrides the configured one. */
    static DaemonConfig loadConfig(Command command) {
        DaemonConfig config = command.configPath() != null
            ? new DaemonConfigReader().read(command.configPath())
            : new DaemonConfig();
        if (command.dataDir() != null) {
            config.setDataDir(command.dataDir());
        }
        return config;
    }

    static int run(Command command) throws IOException {
        DaemonConfig config = loadConfig(command);
        Path dataDir = config.getDataDir();
        return switch (command.action()) {
            case START -> start(config);
            case STOP -> stop(dataDir);
            case STATUS -> {
                System.out.println(SamplerDaemon.status(dataDir).toJson());
                yield 0;
            }
        };
    }

    private static int start(DaemonConfig config) {
        SamplerDaemon daemon = new SamplerDaemon(config);
        daemon.start();
        Runtime.getRuntime().addShutdownHook(new Thread(daemon::stop, "callperf-daemon-shutdown"));
        daemon.awaitTermination();
        return daemon.state() == DaemonState.CRASHED ? 1 : 0;
    }

    private static int stop(Path dataDir) {
        if (!DataDirLock.isHeld(dataDir)) {
            System.err.println("[callperf-daemon] No sampler running on " + dataDir);
            return 0;
        }
        OptionalLong pid = DataDirLock.readPid(dataDir);
        Optional<ProcessHandle> process = pid.isPresent() ? ProcessHandle.of(pid.getAsLong()) : Optional.empty();
        if (process.isEmpty()) {
            System.err.println("[callperf-daemon] Sampler on " + dataDir + " holds the lock but its pid is unknown");
            return 1;
        }
        ProcessHandle handle = process.get();
        handle.destroy();
        try {
            handle.onExit().get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            System.err.println("[callperf-daemon] Sampler pid " + handle.pid() + " did not exit: " + e.getMessage());
            return 1;
        }
        System.err.println("[callperf-daemon] Stopped sampler pid " + handle.pid());
        return 0;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
