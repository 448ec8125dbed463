package com.callperf.agent.sink;

import com.callperf.agent.config.PerfConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the sinks a session writes to from its configuration. */
public final class SinkFactory {

    private static final Logger log = LoggerFactory.getLogger(SinkFactory.class);

    private SinkFactory() {}

    /** The configured storage backend. A remote backend that cannot be built degrades to local. */
    public static Sink primary(PerfConfig config) {
        if (config.storage().isRemote()) {
            try {
                return DynamoDbSink.create(config.remote(), config.upload().getTimeout());
            } catch (RuntimeException e) {
                log.error("Could not create DynamoDB client for table {}, storing locally instead: {}",
                    config.remote().getTableName(), e.getMessage());
            }
        }
        return local(config);
    }

    /** Local sink used when the primary sink keeps failing. */
    public static LocalFileSink fallback(PerfConfig config) {
        PerfConfig.Local local = config.local();
        return new LocalFileSink(local.getFallbackDir(), "json", local.getMaxRecords());
    }

    public static LocalFileSink local(PerfConfig config) {
        PerfConfig.Local local = config.local();
        return new LocalFileSink(local.getDataDir(), local.getFormat(), local.getMaxRecords());
    }
}
