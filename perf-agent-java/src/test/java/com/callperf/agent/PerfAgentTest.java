package com.callperf.agent;

import com.callperf.agent.config.PerfConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class PerfAgentTest {

    @TempDir
    Path dir;

    @AfterEach
    void detach() {
        PerfSession s = PerfAgent.session();
        if (s != null) s.close();
        PerfAgent.attach(null);
    }

    @Test
    void parseArgs_defaults() {
        PerfAgent.AgentArgs args = PerfAgent.parseArgs(null);
        assertNull(args.configPath());
        assertEquals("com.", args.namespace());
        assertNull(args.outputPath());
    }

    @Test
    void parseArgs_allKeys() {
        PerfAgent.AgentArgs args = PerfAgent.parseArgs("config=/etc/perf.json,namespace=org.shop,output=/tmp/out");
        assertEquals("/etc/perf.json", args.configPath());
        assertEquals("org.shop", args.namespace());
        assertEquals("/tmp/out", args.outputPath());
    }

    @Test
    void parseArgs_ignoresMalformedAndUnknownParts() {
        PerfAgent.AgentArgs args = PerfAgent.parseArgs("garbage,colour=blue,namespace=io.app");
        assertEquals("io.app", args.namespace());
    }

    @Test
    void loadConfig_outputOverridesDataDirs() throws Exception {
        Path file = dir.resolve("perf.json");
        Files.writeString(file, "{\"local\": {\"data_dir\": \"/elsewhere\", \"format\": \"csv\"}}");

        PerfConfig config = PerfAgent.loadConfig(new PerfAgent.AgentArgs(file.toString(), "com.", "/tmp/out"));

        assertEquals(Paths.get("/tmp/out"), config.local().getDataDir());
        assertEquals(Paths.get("/tmp/out/fallback"), config.local().getFallbackDir());
        assertEquals("csv", config.local().getFormat());
    }

    @Test
    void loadConfig_unreadableFileFallsBackToDefaults() {
        PerfConfig config = PerfAgent.loadConfig(
            new PerfAgent.AgentArgs(dir.resolve("absent.json").toString(), "com.", null));
        assertEquals("on_exit", config.upload().getStrategy());
    }

    @Test
    void enterAndExitRecordIntoAttachedSession() {
        PerfConfig config = new PerfConfig();
        config.core().setMinExecutionTime(0);
        config.local().setDataDir(dir.resolve("data"));
        config.upload().setStrategy("manual");
        PerfSession session = PerfSession.open(config);
        PerfAgent.attach(session);

        Object m = PerfAgent.enter("com.shop.Cart.add", new Object[]{"sku-1"});
        PerfAgent.exit(m, null);
        Object failed = PerfAgent.enter("com.shop.Cart.remove", new Object[0]);
        PerfAgent.exit(failed, new IllegalArgumentException("no such item"));

        assertEquals(1, session.summary("com.shop.Cart.add").callCount());
        assertEquals("IllegalArgumentException", session.store().allRecords("com.shop.Cart.remove").get(0).thrown());
    }

    @Test
    void enterWithoutSessionIsNoop() {
        PerfAgent.attach(null);
        Object m = PerfAgent.enter("com.shop.Cart.add", new Object[0]);
        assertNull(m);
        assertDoesNotThrow(() -> PerfAgent.exit(m, null));
    }

    @Test
    void closedSessionStopsRecording() {
        PerfConfig config = new PerfConfig();
        config.local().setDataDir(dir.resolve("data"));
        PerfSession session = PerfSession.open(config);
        PerfAgent.attach(session);
        session.close();

        assertNull(PerfAgent.enter("com.shop.Cart.add", new Object[0]));
    }

    @Test
    void typeMatcherSkipsAgentAndItsLibraries() {
        ElementMatcher<TypeDescription> types = PerfAgent.instrumentedTypes("com.");

        assertTrue(types.matches(TypeDescription.ForLoadedType.of(com.sun.management.OperatingSystemMXBean.class)));
        assertFalse(types.matches(TypeDescription.ForLoadedType.of(PerfSession.class)));
        assertFalse(types.matches(TypeDescription.ForLoadedType.of(com.google.gson.Gson.class)));
        assertFalse(types.matches(TypeDescription.ForLoadedType.of(software.amazon.awssdk.services.dynamodb.DynamoDbClient.class)));
        assertFalse(types.matches(TypeDescription.ForLoadedType.of(String.class)));
    }
}
