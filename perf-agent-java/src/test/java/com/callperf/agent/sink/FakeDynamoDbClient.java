package com.callperf.agent.sink;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbServiceClientConfiguration;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** In-memory stand-in for one DynamoDB table. */
class FakeDynamoDbClient implements DynamoDbClient {

    boolean tableExists;
    RuntimeException createFailure;
    final Deque<RuntimeException> putFailures = new ArrayDeque<>();
    final List<PutItemRequest> puts = new ArrayList<>();
    final List<CreateTableRequest> creates = new ArrayList<>();
    int describeCalls;
    boolean closed;

    @Override
    public DescribeTableResponse describeTable(DescribeTableRequest request) {
        describeCalls++;
        if (!tableExists) {
            throw ResourceNotFoundException.builder().message("Requested resource not found").build();
        }
        return DescribeTableResponse.builder()
            .table(TableDescription.builder().tableName(request.tableName()).tableStatus(TableStatus.ACTIVE).build())
            .build();
    }

    @Override
    public CreateTableResponse createTable(CreateTableRequest request) {
        creates.add(request);
        tableExists = true;
        if (createFailure != null) throw createFailure;
        return CreateTableResponse.builder().build();
    }

    @Override
    public PutItemResponse putItem(PutItemRequest request) {
        RuntimeException failure = putFailures.poll();
        if (failure != null) throw failure;
        puts.add(request);
        return PutItemResponse.builder().build();
    }

    @Override
    public String serviceName() {
        return "dynamodb";
    }

    @Override
    public DynamoDbServiceClientConfiguration serviceClientConfiguration() {
        throw new UnsupportedOperationException();
    }

    @Override
    public void close() {
        closed = true;
    }
}
