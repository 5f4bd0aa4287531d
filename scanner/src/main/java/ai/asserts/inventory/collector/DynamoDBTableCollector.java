/*
 *  Copyright © 2022.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSApiCallRateLimiter;
import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.DynamoDbTable;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ListTablesResponse;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * Tables are region wide. Each table listed is described as soon as its page arrives, a table that cannot be described
 * is kept with only its name.
 */
@Component
@Slf4j
public class DynamoDBTableCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;
    private final AWSApiCallRateLimiter rateLimiter;

    public DynamoDBTableCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher,
                                  AWSApiCallRateLimiter rateLimiter) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.DynamoDBTable;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        DynamoDbClient client = awsClientProvider.getDynamoDBClient(scope.getRegion());
        PaginatedFetcher.PageIterator<ListTablesResponse, String> tableNames = fetcher.iterate(scope,
                "DynamoDbClient/listTables",
                token -> client.listTables(ListTablesRequest.builder()
                        .exclusiveStartTableName(token)
                        .build()),
                ListTablesResponse::tableNames, ListTablesResponse::lastEvaluatedTableName);

        List<String> names = new ArrayList<>();
        List<DynamoDbTable> tables = new ArrayList<>();
        Throwable describeFailure = null;
        String api = "DynamoDbClient/describeTable";
        while (tableNames.hasNext()) {
            String tableName = tableNames.next();
            names.add(tableName);
            DynamoDbTable.DynamoDbTableBuilder<?, ?> table = DynamoDbTable.builder()
                    .id(tableName)
                    .region(scope.getRegion());
            try {
                TableDescription description = rateLimiter.doWithRateLimit(api, scope.apiLabels(api),
                        () -> client.describeTable(DescribeTableRequest.builder()
                                .tableName(tableName)
                                .build()).table());
                table.status(description.tableStatusAsString())
                        .billingMode(description.billingModeSummary() != null
                                ? description.billingModeSummary().billingModeAsString() : "PROVISIONED")
                        .arn(description.tableArn())
                        .creationDate(description.creationDateTime())
                        .itemCount(description.itemCount())
                        .sizeBytes(description.tableSizeBytes());
            } catch (RuntimeException e) {
                log.warn("Could not describe table {} in {}", tableName, scope, e);
                describeFailure = e;
            }
            tables.add(table.build());
        }
        return CollectionResult.of(getType(), scope, tableNames.toResult(names), tables, describeFailure);
    }
}
