package com.callperf.daemon.sample;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OsMetricsSourceTest {

    @Test
    void parsesNetDevCounters() {
        List<String> lines = List.of(
            "Inter-|   Receive                                                |  Transmit",
            " face |bytes    packets errs drop fifo frame compressed multicast|bytes    packets errs drop fifo colls carrier compressed",
            "    lo: 1000      10    0    0    0     0          0         0     1000      10    0    0    0     0       0          0",
            "  eth0: 123456   789    0    0    0     0          0         0    65432     321    0    0    0     0       0          0");

        Map<String, SystemSample.NetworkCounters> counters = OsMetricsSource.parseNetDev(lines);

        assertEquals(2, counters.size());
        SystemSample.NetworkCounters eth0 = counters.get("eth0");
        assertEquals(123456, eth0.rxBytes());
        assertEquals(789, eth0.rxPackets());
        assertEquals(65432, eth0.txBytes());
        assertEquals(321, eth0.txPackets());
    }

    @Test
    void malformedNetDevLinesAreSkipped() {
        List<String> lines = List.of("  eth0: x y z", "garbage", "  eth1: 1 2 0 0 0 0 0 0 3 4 0 0 0 0 0 0");
        Map<String, SystemSample.NetworkCounters> counters = OsMetricsSource.parseNetDev(lines);
        assertEquals(1, counters.size());
        assertEquals(3, counters.get("eth1").txBytes());
    }

    @Test
    void parsesMemAvailableInBytes() {
        List<String> lines = List.of("MemTotal:       16384000 kB", "MemFree:         1000000 kB",
            "MemAvailable:    8192000 kB");
        assertEquals(8192000L * 1024, OsMetricsSource.parseMemAvailable(lines).getAsLong());
        assertTrue(OsMetricsSource.parseMemAvailable(List.of("MemTotal: 1 kB")).isEmpty());
    }

    @Test
    void liveSampleHasSaneRanges() {
        SystemSample sample = new OsMetricsSource(true, List.of()).sample(1_700_000_000_000L);

        assertEquals(1_700_000_000_000L, sample.timestampMs());
        assertTrue(sample.cpuPercent() >= 0 && sample.cpuPercent() <= 100);
        assertTrue(sample.memoryPercent() >= 0 && sample.memoryPercent() <= 100);
        assertTrue(sample.memoryTotalBytes() > 0);
        assertNotNull(sample.network());
        assertNull(sample.processes(), "no tracked process patterns");
    }

    @Test
    void trackedProcessPatternFindsThisJvm() {
        OsMetricsSource source = new OsMetricsSource(false, List.of("java"));
        SystemSample sample = source.sample(System.currentTimeMillis());

        assertNull(sample.network());
        assertNotNull(sample.processes());
        long self = ProcessHandle.current().pid();
        assertTrue(sample.processes().stream().anyMatch(p -> p.pid() == self));
    }

    @Test
    void processNameFallsBackToRawCommand() {
        assertEquals("java", OsMetricsSource.processName("/usr/bin/java"));
        assertEquals("/", OsMetricsSource.processName("/"));
        assertEquals("", OsMetricsSource.processName(""));
        assertEquals("bad\u0000name", OsMetricsSource.processName("bad\u0000name"));
    }
}
