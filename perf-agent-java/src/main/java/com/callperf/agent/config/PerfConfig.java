package com.callperf.agent.config;

import com.google.gson.annotations.SerializedName;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Structured configuration for one instrumentation session.
 *
 * Deserialized by {@link PerfConfigReader} from JSON with snake_case keys, or built in code
 * through the section setters. Every getter falls back to a default, so an empty object
 * (or {@code new PerfConfig()}) is a valid zero-setup configuration.
 */
public class PerfConfig {

    @SerializedName("core")
    private Core core;

    @SerializedName("storage")
    private Storage storage;

    @SerializedName("local")
    private Local local;

    @SerializedName("remote")
    private Remote remote;

    @SerializedName("upload")
    private Upload upload;

    @SerializedName("filters")
    private Filters filters;

    public Core core()       { return core    != null ? core    : (core    = new Core()); }
    public Storage storage() { return storage != null ? storage : (storage = new Storage()); }
    public Local local()     { return local   != null ? local   : (local   = new Local()); }
    public Remote remote()   { return remote  != null ? remote  : (remote  = new Remote()); }
    public Upload upload()   { return upload  != null ? upload  : (upload  = new Upload()); }
    public Filters filters() { return filters != null ? filters : (filters = new Filters()); }

    public static PerfConfig defaults() {
        return new PerfConfig();
    }

    // -----------------------------------------------------------------------
    // Sections
    // -----------------------------------------------------------------------

    public static class Core {
        @SerializedName("enabled")            private Boolean enabled;
        @SerializedName("debug")              private Boolean debug;
        /** Seconds. Calls faster than this are not recorded. */
        @SerializedName("min_execution_time") private Double minExecutionTime;
        @SerializedName("max_tracked_calls")  private Integer maxTrackedCalls;

        public boolean isEnabled()        { return enabled == null || enabled; }
        public boolean isDebug()          { return debug != null && debug; }
        public double getMinExecutionTime() { return minExecutionTime != null ? minExecutionTime : 0.001; }
        public int getMaxTrackedCalls()   { return maxTrackedCalls != null ? maxTrackedCalls : 10_000; }

        public Core setEnabled(boolean enabled)                { this.enabled = enabled; return this; }
        public Core setDebug(boolean debug)                    { this.debug = debug; return this; }
        public Core setMinExecutionTime(double seconds)        { this.minExecutionTime = seconds; return this; }
        public Core setMaxTrackedCalls(int maxTrackedCalls)    { this.maxTrackedCalls = maxTrackedCalls; return this; }
    }

    public static class Storage {
        /** "local" or "remote". */
        @SerializedName("backend") private String backend;

        public String getBackend() { return backend != null ? backend : "local"; }
        public boolean isRemote()  { return "remote".equalsIgnoreCase(getBackend()); }

        public Storage setBackend(String backend) { this.backend = backend; return this; }
    }

    public static class Local {
        @SerializedName("data_dir")     private String dataDir;
        /** "json" or "csv". */
        @SerializedName("format")       private String format;
        @SerializedName("max_records")  private Integer maxRecords;
        @SerializedName("fallback_dir") private String fallbackDir;

        public Path getDataDir()   { return Paths.get(dataDir != null ? dataDir : "./perf_data"); }
        public String getFormat()  { return format != null ? format : "json"; }
        public int getMaxRecords() { return maxRecords != null ? maxRecords : 1000; }
        public Path getFallbackDir() {
            return fallbackDir != null ? Paths.get(fallbackDir) : getDataDir().resolve("fallback");
        }

        public Local setDataDir(Path dataDir)         { this.dataDir = dataDir.toString(); return this; }
        public Local setFormat(String format)         { this.format = format; return this; }
        public Local setMaxRecords(int maxRecords)    { this.maxRecords = maxRecords; return this; }
        public Local setFallbackDir(Path fallbackDir) { this.fallbackDir = fallbackDir.toString(); return this; }
    }

    public static class Remote {
        @SerializedName("table_name")        private String tableName;
        @SerializedName("region")            private String region;
        @SerializedName("profile")           private String profile;
        @SerializedName("auto_create_table") private Boolean autoCreateTable;
        @SerializedName("read_capacity")     private Long readCapacity;
        @SerializedName("write_capacity")    private Long writeCapacity;
        /** Optional endpoint override, e.g. a local DynamoDB emulator. */
        @SerializedName("endpoint")          private String endpoint;

        public String getTableName()       { return tableName != null ? tableName : "callperf-data"; }
        public String getRegion()          { return region != null ? region : "us-east-1"; }
        public String getProfile()         { return profile; }
        public boolean isAutoCreateTable() { return autoCreateTable == null || autoCreateTable; }
        public long getReadCapacity()      { return readCapacity != null ? readCapacity : 5L; }
        public long getWriteCapacity()     { return writeCapacity != null ? writeCapacity : 5L; }
        public String getEndpoint()        { return endpoint; }

        public Remote setTableName(String tableName)          { this.tableName = tableName; return this; }
        public Remote setRegion(String region)                { this.region = region; return this; }
        public Remote setProfile(String profile)              { this.profile = profile; return this; }
        public Remote setAutoCreateTable(boolean autoCreate)  { this.autoCreateTable = autoCreate; return this; }
        public Remote setReadCapacity(long readCapacity)      { this.readCapacity = readCapacity; return this; }
        public Remote setWriteCapacity(long writeCapacity)    { this.writeCapacity = writeCapacity; return this; }
        public Remote setEndpoint(String endpoint)            { this.endpoint = endpoint; return this; }
    }

    public static class Upload {
        /** "on_exit", "real_time", "batch" or "manual". */
        @SerializedName("strategy")       private String strategy;
        @SerializedName("batch_size")     private Integer batchSize;
        /** Seconds. */
        @SerializedName("batch_interval") private Double batchInterval;
        @SerializedName("retry_attempts") private Integer retryAttempts;
        /** Seconds. */
        @SerializedName("timeout")        private Double timeout;

        public String getStrategy()        { return strategy != null ? strategy : "on_exit"; }
        public int getBatchSize()          { return batchSize != null ? batchSize : 100; }
        public Duration getBatchInterval() { return seconds(batchInterval != null ? batchInterval : 60.0); }
        public int getRetryAttempts()      { return retryAttempts != null ? retryAttempts : 3; }
        public Duration getTimeout()       { return seconds(timeout != null ? timeout : 30.0); }

        public Upload setStrategy(String strategy)         { this.strategy = strategy; return this; }
        public Upload setBatchSize(int batchSize)          { this.batchSize = batchSize; return this; }
        public Upload setBatchInterval(double seconds)     { this.batchInterval = seconds; return this; }
        public Upload setRetryAttempts(int retryAttempts)  { this.retryAttempts = retryAttempts; return this; }
        public Upload setTimeout(double seconds)           { this.timeout = seconds; return this; }

        private static Duration seconds(double value) {
            return Duration.ofNanos(Math.round(value * 1_000_000_000L));
        }
    }

    public static class Filters {
        /** Libraries callperf itself calls while delivering and logging; never worth timing. */
        public static final List<String> DEFAULT_EXCLUDE_MODULES =
            List.of("com.google.gson", "software.amazon", "org.slf4j", "ch.qos.logback");

        @SerializedName("exclude_modules")     private List<String> excludeModules;
        @SerializedName("include_modules")     private List<String> includeModules;
        @SerializedName("exclude_functions")   private List<String> excludeFunctions;
        @SerializedName("include_functions")   private List<String> includeFunctions;
        @SerializedName("track_arguments")     private Boolean trackArguments;
        @SerializedName("max_argument_length") private Integer maxArgumentLength;

        public List<String> getExcludeModules()   { return excludeModules   != null ? excludeModules   : DEFAULT_EXCLUDE_MODULES; }
        public List<String> getIncludeModules()   { return includeModules   != null ? includeModules   : Collections.emptyList(); }
        public List<String> getExcludeFunctions() { return excludeFunctions != null ? excludeFunctions : Collections.emptyList(); }
        public List<String> getIncludeFunctions() { return includeFunctions != null ? includeFunctions : Collections.emptyList(); }
        public boolean isTrackArguments()         { return trackArguments != null && trackArguments; }
        public int getMaxArgumentLength()         { return maxArgumentLength != null ? maxArgumentLength : 256; }

        public Filters setExcludeModules(List<String> patterns)   { this.excludeModules = patterns; return this; }
        public Filters setIncludeModules(List<String> patterns)   { this.includeModules = patterns; return this; }
        public Filters setExcludeFunctions(List<String> patterns) { this.excludeFunctions = patterns; return this; }
        public Filters setIncludeFunctions(List<String> patterns) { this.includeFunctions = patterns; return this; }
        public Filters setTrackArguments(boolean track)           { this.trackArguments = track; return this; }
        public Filters setMaxArgumentLength(int length)           { this.maxArgumentLength = length; return this; }
    }
}
