package com.callperf.agent.sink;

import com.callperf.agent.config.PerfConfig;
import com.callperf.agent.record.CallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Uploads each flush as a single item to a DynamoDB table.
 *
 * Items are keyed by a numeric {@code id} taken from a microsecond clock and forced to grow
 * strictly, so flushes from one session never collide. Summary totals are stored as top-level
 * numeric attributes next to the JSON payload so they can be filtered without parsing it.
 *
 * On first use the table is described and, if missing and auto-creation is enabled, created
 * with {@code id} as hash key. A concurrent creator winning the race is not an error.
 */
public class DynamoDbSink implements Sink {

    private static final Logger log = LoggerFactory.getLogger(DynamoDbSink.class);

    static final String KEY = "id";
    private static final int ACTIVE_POLL_ATTEMPTS = 30;
    private static final Duration ACTIVE_POLL_INTERVAL = Duration.ofSeconds(1);

    private final DynamoDbClient client;
    private final String tableName;
    private final boolean autoCreateTable;
    private final long readCapacity;
    private final long writeCapacity;

    private final AtomicLong lastId = new AtomicLong();
    private volatile boolean tableReady;

    public DynamoDbSink(DynamoDbClient client, String tableName, boolean autoCreateTable,
                        long readCapacity, long writeCapacity) {
        this.client = client;
        this.tableName = tableName;
        this.autoCreateTable = autoCreateTable;
        this.readCapacity = readCapacity;
        this.writeCapacity = writeCapacity;
    }

    /** Builds a sink with its own client from the remote section of the configuration. */
    public static DynamoDbSink create(PerfConfig.Remote remote, Duration timeout) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
            .region(Region.of(remote.getRegion()))
            .overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(timeout)
                .build());
        if (remote.getProfile() != null) {
            builder.credentialsProvider(ProfileCredentialsProvider.create(remote.getProfile()));
        }
        if (remote.getEndpoint() != null) {
            builder.endpointOverride(URI.create(remote.getEndpoint()));
        }
        return new DynamoDbSink(builder.build(), remote.getTableName(), remote.isAutoCreateTable(),
            remote.getReadCapacity(), remote.getWriteCapacity());
    }

    @Override
    public String name() {
        return "dynamodb:" + tableName;
    }

    @Override
    public SinkResult write(String sessionId, List<CallRecord> records, FlushMetadata metadata) {
        ensureTable();

        FlushPayload payload = FlushPayload.build(sessionId, records, metadata);
        long id = nextId();

        Map<String, AttributeValue> item = new HashMap<>();
        item.put(KEY, number(id));
        item.put("session_id", AttributeValue.fromS(sessionId));
        item.put("upload_timestamp", number(metadata.flushTime().toEpochMilli() / 1000.0));
        item.put("hostname", AttributeValue.fromS(metadata.hostname()));
        item.put("data", AttributeValue.fromS(payload.toJson()));
        item.put("total_calls", number(payload.totalCalls));
        item.put("total_wall_time", number(payload.totalWallTime));
        item.put("total_cpu_time", number(payload.totalCpuTime));

        try {
            client.putItem(PutItemRequest.builder().tableName(tableName).item(item).build());
        } catch (SdkException e) {
            throw classify("put item into " + tableName, e);
        }
        log.debug("Uploaded {} records to {} with id {}", records.size(), tableName, id);
        return new SinkResult(tableName + "#" + id, records.size());
    }

    /** Strictly increasing key derived from a microsecond-resolution timestamp. */
    long nextId() {
        Instant now = Instant.now();
        long micros = now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000;
        return lastId.updateAndGet(prev -> Math.max(prev + 1, micros));
    }

    synchronized void ensureTable() {
        if (tableReady) return;
        try {
            TableStatus status = client.describeTable(DescribeTableRequest.builder().tableName(tableName).build())
                .table().tableStatus();
            if (status != TableStatus.ACTIVE) {
                waitUntilActive();
            }
            tableReady = true;
            return;
        } catch (ResourceNotFoundException e) {
            if (!autoCreateTable) {
                throw new PermanentDeliveryException("Table " + tableName + " does not exist and auto-creation is off", e);
            }
        } catch (SdkException e) {
            throw classify("describe table " + tableName, e);
        }

        createTable();
        waitUntilActive();
        tableReady = true;
    }

    private void createTable() {
        log.info("Creating table {} (read={}, write={})", tableName, readCapacity, writeCapacity);
        try {
            client.createTable(CreateTableRequest.builder()
                .tableName(tableName)
                .keySchema(KeySchemaElement.builder().attributeName(KEY).keyType(KeyType.HASH).build())
                .attributeDefinitions(AttributeDefinition.builder()
                    .attributeName(KEY).attributeType(ScalarAttributeType.N).build())
                .provisionedThroughput(ProvisionedThroughput.builder()
                    .readCapacityUnits(readCapacity)
                    .writeCapacityUnits(writeCapacity)
                    .build())
                .build());
        } catch (ResourceInUseException e) {
            log.debug("Table {} was created concurrently", tableName);
        } catch (SdkException e) {
            throw classify("create table " + tableName, e);
        }
    }

    private void waitUntilActive() {
        DescribeTableRequest request = DescribeTableRequest.builder().tableName(tableName).build();
        for (int attempt = 0; attempt < ACTIVE_POLL_ATTEMPTS; attempt++) {
            try {
                if (client.describeTable(request).table().tableStatus() == TableStatus.ACTIVE) return;
            } catch (ResourceNotFoundException e) {
                // a freshly created table may not be visible yet
                log.debug("Table {} not visible yet (attempt {})", tableName, attempt + 1);
            } catch (SdkException e) {
                throw classify("wait for table " + tableName, e);
            }
            try {
                Thread.sleep(ACTIVE_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientDeliveryException("Interrupted while waiting for table " + tableName, e);
            }
        }
        throw new TransientDeliveryException("Table " + tableName + " did not become active");
    }

    static DeliveryException classify(String action, SdkException e) {
        String message = "Failed to " + action + ": " + e.getMessage();
        if (e instanceof ProvisionedThroughputExceededException
                || e instanceof RequestLimitExceededException
                || e instanceof LimitExceededException
                || e instanceof InternalServerErrorException) {
            return new TransientDeliveryException(message, e);
        }
        if (e instanceof AwsServiceException service) {
            if (service.isThrottlingException() || service.statusCode() >= 500) {
                return new TransientDeliveryException(message, e);
            }
            return new PermanentDeliveryException(message, e);
        }
        if (e instanceof SdkClientException) {
            // timeouts, connection resets, DNS failures
            return new TransientDeliveryException(message, e);
        }
        return e.retryable()
            ? new TransientDeliveryException(message, e)
            : new PermanentDeliveryException(message, e);
    }

    private static AttributeValue number(long n) {
        return AttributeValue.fromN(Long.toString(n));
    }

    private static AttributeValue number(double n) {
        return AttributeValue.fromN(BigDecimal.valueOf(n).toPlainString());
    }

    @Override
    public void close() {
        client.close();
    }
}
