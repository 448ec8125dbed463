package com.callperf.daemon.sample;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Samples the host through the platform {@code com.sun.management.OperatingSystemMXBean},
 * {@code /proc} where present, and {@link ProcessHandle} for tracked processes.
 */
public class OsMetricsSource implements SystemMetricsSource {

    private static final Logger log = LoggerFactory.getLogger(OsMetricsSource.class);

    private static final Path NET_DEV = Paths.get("/proc/net/dev");
    private static final Path MEM_INFO = Paths.get("/proc/meminfo");

    private final com.sun.management.OperatingSystemMXBean os;
    private final boolean collectNetwork;
    private final List<Pattern> trackProcesses;
    /** Total CPU time per tracked pid at the previous tick, with the tick's wall time. */
    private final Map<Long, long[]> previousCpu = new HashMap<>();

    public OsMetricsSource(boolean collectNetwork, List<String> trackProcesses) {
        this.os = (com.sun.management.OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
        this.collectNetwork = collectNetwork;
        this.trackProcesses = trackProcesses.stream().map(Pattern::compile).collect(Collectors.toList());
    }

    @Override
    public SystemSample sample(long epochMillis) {
        double cpuLoad = os.getCpuLoad();
        double cpuPercent = cpuLoad < 0 ? 0.0 : round(cpuLoad * 100.0);

        long total = os.getTotalMemorySize();
        long available = readMemAvailable().orElse(os.getFreeMemorySize());
        long used = Math.max(0, total - available);
        double memoryPercent = total > 0 ? round(used * 100.0 / total) : 0.0;

        Map<String, SystemSample.NetworkCounters> network = collectNetwork ? readNetwork() : null;
        List<SystemSample.ProcessUsage> processes = trackProcesses.isEmpty() ? null : sampleProcesses(epochMillis);

        return new SystemSample(epochMillis, Instant.ofEpochMilli(epochMillis).toString(),
            cpuPercent, memoryPercent, used, total, network, processes);
    }

    private java.util.OptionalLong readMemAvailable() {
        if (!Files.isReadable(MEM_INFO)) return java.util.OptionalLong.empty();
        try {
            return parseMemAvailable(Files.readAllLines(MEM_INFO, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", MEM_INFO, e.getMessage());
            return java.util.OptionalLong.empty();
        }
    }

    private Map<String, SystemSample.NetworkCounters> readNetwork() {
        if (!Files.isReadable(NET_DEV)) return Collections.emptyMap();
        try {
            return parseNetDev(Files.readAllLines(NET_DEV, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", NET_DEV, e.getMessage());
            return Collections.emptyMap();
        }
    }

    private List<SystemSample.ProcessUsage> sampleProcesses(long epochMillis) {
        List<SystemSample.ProcessUsage> result = new ArrayList<>();
        Map<Long, long[]> seen = new HashMap<>();
        ProcessHandle.allProcesses().forEach(handle -> {
            ProcessHandle.Info info = handle.info();
            String command = info.commandLine().orElse(info.command().orElse(null));
            if (command == null || trackProcesses.stream().noneMatch(p -> p.matcher(command).find())) return;

            long pid = handle.pid();
            long cpuNanos = info.totalCpuDuration().map(Duration::toNanos).orElse(-1L);
            double cpuPercent = 0.0;
            long[] previous = previousCpu.get(pid);
            if (previous != null && cpuNanos >= 0 && epochMillis > previous[1]) {
                long wallNanos = (epochMillis - previous[1]) * 1_000_000L;
                cpuPercent = round(Math.max(0, cpuNanos - previous[0]) * 100.0 / wallNanos);
            }
            if (cpuNanos >= 0) seen.put(pid, new long[] { cpuNanos, epochMillis });
            String name = processName(info.command().orElse(command));
            result.add(new SystemSample.ProcessUsage(pid, name, cpuPercent, readRss(pid)));
        });
        previousCpu.clear();
        previousCpu.putAll(seen);
        return result;
    }

    /** Executable file name of {@code command}, or the command itself when it has none. */
    static String processName(String command) {
        try {
            Path fileName = Paths.get(command).getFileName();
            return fileName != null ? fileName.toString() : command;
        } catch (InvalidPathException e) {
            return command;
        }
    }

    private static long readRss(long pid) {
        Path status = Paths.get("/proc", Long.toString(pid), "status");
        if (!Files.isReadable(status)) return -1;
        try {
            for (String line : Files.readAllLines(status, StandardCharsets.UTF_8)) {
                if (line.startsWith("VmRSS:")) {
                    return kilobytes(line);
                }
            }
        } catch (IOException e) {
            // process exited between listing and reading
            log.trace("Cannot read {}: {}", status, e.getMessage());
        }
        return -1;
    }

    /** Parses {@code /proc/net/dev}: two header lines, then one {@code iface: counters...} line each. */
    static Map<String, SystemSample.NetworkCounters> parseNetDev(List<String> lines) {
        Map<String, SystemSample.NetworkCounters> result = new LinkedHashMap<>();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String iface = line.substring(0, colon).trim();
            String[] fields = line.substring(colon + 1).trim().split("\\s+");
            if (iface.isEmpty() || fields.length < 10) continue;
            try {
                result.put(iface, new SystemSample.NetworkCounters(
                    Long.parseLong(fields[0]), Long.parseLong(fields[8]),
                    Long.parseLong(fields[1]), Long.parseLong(fields[9])));
            } catch (NumberFormatException e) {
                log.debug("Skipping malformed /proc/net/dev line: {}", line);
            }
        }
        return result;
    }

    /** Extracts {@code MemAvailable} in bytes from {@code /proc/meminfo} lines. */
    static java.util.OptionalLong parseMemAvailable(List<String> lines) {
        for (String line : lines) {
            if (line.startsWith("MemAvailable:")) {
                long bytes = kilobytes(line);
                return bytes >= 0 ? java.util.OptionalLong.of(bytes) : java.util.OptionalLong.empty();
            }
        }
        return java.util.OptionalLong.empty();
    }

    private static long kilobytes(String line) {
        String[] parts = line.substring(line.indexOf(':') + 1).trim().split("\\s+");
        try {
            return Long.parseLong(parts[0]) * 1024L;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
