/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataResponse;
import software.amazon.awssdk.services.cloudwatch.model.Metric;
import software.amazon.awssdk.services.cloudwatch.model.MetricDataQuery;
import software.amazon.awssdk.services.cloudwatch.model.MetricDataResult;
import software.amazon.awssdk.services.cloudwatch.model.MetricStat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the daily S3 storage metrics of the buckets of one region. The size of a bucket is the sum of
 * <code>BucketSizeBytes</code> over all storage types. The most recent published day is used and nothing is waited
 * for, a bucket without published metrics has no size.
 */
@Component
@Slf4j
public class S3StorageMetricsFetcher {
    public static final String NAMESPACE = "AWS/S3";
    public static final int PERIOD_SECONDS = 86400;
    @VisibleForTesting
    static final List<String> STORAGE_TYPES = ImmutableList.of(
            "StandardStorage", "IntelligentTieringFAStorage", "IntelligentTieringIAStorage",
            "IntelligentTieringAAStorage", "IntelligentTieringAIAStorage", "IntelligentTieringDAAStorage",
            "StandardIAStorage", "StandardIASizeOverhead", "OneZoneIAStorage", "OneZoneIASizeOverhead",
            "ReducedRedundancyStorage", "GlacierInstantRetrievalStorage", "GlacierIRSizeOverhead", "GlacierStorage",
            "GlacierStagingStorage", "GlacierObjectOverhead", "GlacierS3ObjectOverhead", "DeepArchiveStorage",
            "DeepArchiveObjectOverhead", "DeepArchiveS3ObjectOverhead", "DeepArchiveStagingStorage");
    private static final int MAX_QUERIES_PER_REQUEST = 500;
    @VisibleForTesting
    static final int BUCKETS_PER_REQUEST = MAX_QUERIES_PER_REQUEST / (STORAGE_TYPES.size() + 1);

    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;
    private final TimeWindowBuilder timeWindowBuilder;

    public S3StorageMetricsFetcher(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher,
                                   TimeWindowBuilder timeWindowBuilder) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
        this.timeWindowBuilder = timeWindowBuilder;
    }

    /**
     * @param scope   scope of the region the buckets are in
     * @param buckets names of buckets in that region
     */
    public StorageMetrics fetchMetrics(ScanScope scope, List<String> buckets) {
        CloudWatchClient cloudWatchClient = awsClientProvider.getCloudWatchClient(scope.getRegion());
        Instant[] timePeriod = timeWindowBuilder.getDailyMetricTimeWindow(scope.getRegion(), 2);
        Map<String, Long> sizeBytes = new HashMap<>();
        Map<String, Long> objectCounts = new HashMap<>();
        Throwable failure = null;
        for (List<String> batch : Lists.partition(buckets, BUCKETS_PER_REQUEST)) {
            List<MetricDataQuery> queries = new ArrayList<>();
            for (int i = 0; i < batch.size(); i++) {
                String bucket = batch.get(i);
                for (int j = 0; j < STORAGE_TYPES.size(); j++) {
                    queries.add(query("size_" + i + "_" + j, "BucketSizeBytes", bucket, STORAGE_TYPES.get(j)));
                }
                queries.add(query("objects_" + i, "NumberOfObjects", bucket, "AllStorageTypes"));
            }
            FetchResult<MetricDataResult> fetch = fetcher.fetchAll(scope, "CloudWatchClient/getMetricData",
                    token -> cloudWatchClient.getMetricData(GetMetricDataRequest.builder()
                            .startTime(timePeriod[0])
                            .endTime(timePeriod[1])
                            .metricDataQueries(queries)
                            .nextToken(token)
                            .build()),
                    GetMetricDataResponse::metricDataResults, GetMetricDataResponse::nextToken);
            if (fetch.getFailure() != null && failure == null) {
                failure = fetch.getFailure();
            }
            // Values are newest first, the first value seen for a query is the most recent day
            Map<String, Double> latest = new HashMap<>();
            fetch.getRecords().stream()
                    .filter(MetricDataResult::hasValues)
                    .filter(result -> !result.values().isEmpty())
                    .forEach(result -> latest.putIfAbsent(result.id(), result.values().get(0)));
            for (int i = 0; i < batch.size(); i++) {
                String bucket = batch.get(i);
                long total = 0;
                boolean found = false;
                for (int j = 0; j < STORAGE_TYPES.size(); j++) {
                    Double value = latest.get("size_" + i + "_" + j);
                    if (value != null) {
                        total += value.longValue();
                        found = true;
                    }
                }
                if (found) {
                    sizeBytes.put(bucket, total);
                }
                Double objects = latest.get("objects_" + i);
                if (objects != null) {
                    objectCounts.put(bucket, objects.longValue());
                }
            }
        }
        return new StorageMetrics(sizeBytes, objectCounts, failure);
    }

    private MetricDataQuery query(String id, String metricName, String bucket, String storageType) {
        return MetricDataQuery.builder()
                .id(id)
                .returnData(true)
                .metricStat(MetricStat.builder()
                        .period(PERIOD_SECONDS)
                        .stat("Average")
                        .metric(Metric.builder()
                                .namespace(NAMESPACE)
                                .metricName(metricName)
                                .dimensions(
                                        Dimension.builder().name("BucketName").value(bucket).build(),
                                        Dimension.builder().name("StorageType").value(storageType).build())
                                .build())
                        .build())
                .build();
    }

    @Getter
    @AllArgsConstructor
    public static class StorageMetrics {
        private final Map<String, Long> sizeBytes;
        private final Map<String, Long> objectCounts;
        private final Throwable failure;
    }
}
