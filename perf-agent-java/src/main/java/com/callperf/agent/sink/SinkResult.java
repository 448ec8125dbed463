package com.callperf.agent.sink;

/**
 * Acknowledgement of a successful write.
 *
 * @param location    where the batch landed: a file path or a table key
 * @param recordCount number of records written
 */
public record SinkResult(String location, int recordCount) {}
