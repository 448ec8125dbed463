package com.callperf.agent;

import com.callperf.agent.config.PerfConfig;
import com.callperf.agent.config.PerfConfigReader;
import com.callperf.agent.record.Measurement;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.utility.JavaModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.instrument.Instrumentation;
import java.nio.file.Path;
import java.nio.file.Paths;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java agent entry point that times every method of an application namespace.
 * Attached via:
 *   java -javaagent:perf-agent-java.jar=config=/etc/callperf.json,namespace=com.myapp -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   config    : JSON configuration file (default: built-in defaults)
 *   namespace : class name prefix to instrument (default: "com.")
 *   output    : overrides the local data directory of the configuration
 *
 * The agent opens one {@link PerfSession} and closes it from a JVM shutdown hook.
 */
public final class PerfAgent {

    private static final Logger log = LoggerFactory.getLogger(PerfAgent.class);

    /** Session fed by {@link TimingAdvice}; set during premain. */
    private static volatile PerfSession session;

    private PerfAgent() {}

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        AgentArgs args = parseArgs(agentArgs);
        PerfSession opened = PerfSession.open(loadConfig(args)).registerShutdownHook();
        session = opened;
        log.info("Instrumenting namespace {} for session {}", args.namespace(), opened.sessionId());

        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    log.warn("Could not instrument {}: {}", typeName, throwable.toString());
                }
            })
            .type(instrumentedTypes(args.namespace()))
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.visit(Advice.to(TimingAdvice.class).on(
                    isMethod()
                        .and(not(isAbstract()))
                        .and(not(isNative()))
                        .and(not(isSynthetic()))
                        .and(not(isBridge()))
                ))
            )
            .installOn(instrumentation);
    }

    /** Called when the agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    /**
     * Classes of {@code namespace}, minus proxies, generated classes, the agent itself and the
     * libraries it delivers and logs with (the recorder must not time itself).
     */
    static ElementMatcher.Junction<TypeDescription> instrumentedTypes(String namespace) {
        ElementMatcher.Junction<TypeDescription> matcher = nameStartsWith(namespace)
            .and(not(nameStartsWith("com.callperf.")));
        for (String library : PerfConfig.Filters.DEFAULT_EXCLUDE_MODULES) {
            matcher = matcher.and(not(nameStartsWith(library + ".")));
        }
        return matcher
            .and(not(nameContains("$$EnhancerBySpring")))
            .and(not(nameContains("$Proxy")))
            .and(not(nameContains("CGLIB")))
            .and(not(nameContains("$$Lambda")));
    }

    // -----------------------------------------------------------------------
    // Entry points for inlined advice
    // -----------------------------------------------------------------------

    public static Object enter(String qualifiedName, Object[] args) {
        PerfSession s = session;
        if (s == null || s.isClosed()) return null;
        return s.recorder().start(qualifiedName, args);
    }

    public static void exit(Object measurement, Throwable thrown) {
        if (measurement instanceof Measurement m) {
            if (thrown != null) m.failed(thrown);
            m.close();
        }
    }

    static PerfSession session() {
        return session;
    }

    static void attach(PerfSession s) {
        session = s;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static AgentArgs parseArgs(String agentArgs) {
        String config = null;
        String namespace = "com.";
        String output = null;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length != 2) continue;
                String value = kv[1].trim();
                switch (kv[0].trim()) {
                    case "config"    -> config = value;
                    case "namespace" -> namespace = value;
                    case "output"    -> output = value;
                    default          -> log.warn("Ignoring unknown agent argument: {}", kv[0].trim());
                }
            }
        }
        return new AgentArgs(config, namespace, output);
    }

    static PerfConfig loadConfig(AgentArgs args) {
        PerfConfig config = PerfConfig.defaults();
        if (args.configPath() != null) {
            try {
                config = new PerfConfigReader().read(Paths.get(args.configPath()));
            } catch (PerfConfigReader.ConfigReadException e) {
                log.error("Using default configuration: {}", e.getMessage());
            }
        }
        if (args.outputPath() != null) {
            Path output = Paths.get(args.outputPath());
            config.local().setDataDir(output).setFallbackDir(output.resolve("fallback"));
        }
        return config;
    }

    record AgentArgs(String configPath, String namespace, String outputPath) {}
}
