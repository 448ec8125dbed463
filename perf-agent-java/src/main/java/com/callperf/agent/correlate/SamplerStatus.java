package com.callperf.agent.correlate;

import com.google.gson.annotations.SerializedName;

/**
 * Read model of the sampler's {@code sampler.status.json}, as last persisted by the sampler.
 * A crashed sampler may have left {@code running} set; the state is reported as recorded.
 */
public class SamplerStatus {

    public static final String FILE_NAME = "sampler.status.json";

    @SerializedName("state")            public String state;
    @SerializedName("running")          public boolean running;
    @SerializedName("pid")              public long pid;
    @SerializedName("last_sample_time") public String lastSampleTime;
    @SerializedName("last_flush_time")  public String lastFlushTime;
    @SerializedName("metric_files")     public int metricFiles;
}
