package com.callperf.agent.sink;

import com.callperf.agent.record.CallRecord;
import com.callperf.agent.store.FunctionSummary;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Serialized form of one flushed batch, shared by the file and table sinks.
 *
 * JSON schema:
 * {
 *   "session_id": "...", "hostname": "...", "session_start": "...", "flush_time": "...",
 *   "reason": "on_exit", "total_calls": 3, "total_wall_time": 0.12, "total_cpu_time": 0.05,
 *   "summaries": [ {"function": "...", "call_count": 3, "wall_total": ..., ...} ],
 *   "records":   [ {"function": "...", "wall_time": ..., "cpu_time": ..., "timestamp": "..."} ]
 * }
 */
public class FlushPayload {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
    private static final Gson PRETTY = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    @SerializedName("session_id")      public String sessionId;
    @SerializedName("hostname")        public String hostname;
    @SerializedName("session_start")   public String sessionStart;
    @SerializedName("flush_time")      public String flushTime;
    @SerializedName("reason")          public String reason;
    @SerializedName("total_calls")     public long totalCalls;
    @SerializedName("total_wall_time") public double totalWallTime;
    @SerializedName("total_cpu_time")  public double totalCpuTime;
    @SerializedName("summaries")       public List<SummaryEntry> summaries;
    @SerializedName("records")         public List<RecordEntry> records;

    public static class SummaryEntry {
        @SerializedName("function")   public String function;
        @SerializedName("call_count") public long callCount;
        @SerializedName("wall_total") public double wallTotal;
        @SerializedName("wall_avg")   public double wallAverage;
        @SerializedName("wall_min")   public double wallMin;
        @SerializedName("wall_max")   public double wallMax;
        @SerializedName("cpu_total")  public double cpuTotal;
        @SerializedName("cpu_avg")    public double cpuAverage;
        @SerializedName("cpu_min")    public double cpuMin;
        @SerializedName("cpu_max")    public double cpuMax;
    }

    public static class RecordEntry {
        @SerializedName("function")  public String function;
        @SerializedName("wall_time") public double wallTime;
        @SerializedName("cpu_time")  public double cpuTime;
        @SerializedName("timestamp") public String timestamp;
        @SerializedName("arguments") public List<Map<String, String>> arguments;
        @SerializedName("thrown")    public String thrown;
    }

    public static FlushPayload build(String sessionId, List<CallRecord> records, FlushMetadata metadata) {
        FlushPayload payload = new FlushPayload();
        payload.sessionId = sessionId;
        payload.hostname = metadata.hostname();
        payload.sessionStart = metadata.sessionStart().toString();
        payload.flushTime = metadata.flushTime().toString();
        payload.reason = metadata.reason();
        payload.totalCalls = records.size();

        // Summaries sorted by function name for deterministic output
        Map<String, List<CallRecord>> grouped = records.stream()
            .collect(Collectors.groupingBy(CallRecord::qualifiedName, TreeMap::new, Collectors.toList()));
        payload.summaries = new ArrayList<>();
        for (Map.Entry<String, List<CallRecord>> e : grouped.entrySet()) {
            FunctionSummary s = FunctionSummary.of(e.getKey(), e.getValue());
            SummaryEntry entry = new SummaryEntry();
            entry.function = s.qualifiedName();
            entry.callCount = s.callCount();
            entry.wallTotal = s.wallTime().total();
            entry.wallAverage = s.wallTime().average();
            entry.wallMin = s.wallTime().min();
            entry.wallMax = s.wallTime().max();
            entry.cpuTotal = s.cpuTime().total();
            entry.cpuAverage = s.cpuTime().average();
            entry.cpuMin = s.cpuTime().min();
            entry.cpuMax = s.cpuTime().max();
            payload.summaries.add(entry);
            payload.totalWallTime += entry.wallTotal;
            payload.totalCpuTime += entry.cpuTotal;
        }

        payload.records = new ArrayList<>(records.size());
        for (CallRecord r : records) {
            RecordEntry entry = new RecordEntry();
            entry.function = r.qualifiedName();
            entry.wallTime = r.wallTime();
            entry.cpuTime = r.cpuTime();
            entry.timestamp = r.timestamp().toString();
            entry.arguments = r.arguments();
            entry.thrown = r.thrown();
            payload.records.add(entry);
        }
        return payload;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public String toPrettyJson() {
        return PRETTY.toJson(this);
    }

    public static FlushPayload fromJson(String json) {
        return GSON.fromJson(json, FlushPayload.class);
    }
}
