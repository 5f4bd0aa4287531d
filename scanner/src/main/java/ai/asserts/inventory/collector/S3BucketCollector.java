/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSApiCallRateLimiter;
import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.S3Bucket;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.GetBucketLocationRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.springframework.util.StringUtils.hasLength;

/**
 * Buckets are global. They are listed from the home region, each bucket's region is looked up and the storage metrics
 * are read from CloudWatch in the bucket's region.
 */
@Component
@Slf4j
public class S3BucketCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;
    private final AWSApiCallRateLimiter rateLimiter;
    private final S3StorageMetricsFetcher metricsFetcher;

    public S3BucketCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher,
                             AWSApiCallRateLimiter rateLimiter, S3StorageMetricsFetcher metricsFetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
        this.rateLimiter = rateLimiter;
        this.metricsFetcher = metricsFetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.S3Bucket;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        S3Client s3Client = awsClientProvider.getS3Client(scope.getRegion());
        FetchResult<Bucket> fetch = fetcher.fetchAll(scope, "S3Client/listBuckets",
                token -> s3Client.listBuckets(ListBucketsRequest.builder().build()),
                ListBucketsResponse::buckets, response -> null);

        Throwable enrichmentFailure = null;
        Map<String, String> bucketRegions = new LinkedHashMap<>();
        String api = "S3Client/getBucketLocation";
        for (Bucket bucket : fetch.getRecords()) {
            try {
                String location = rateLimiter.doWithRateLimit(api, scope.apiLabels(api),
                        () -> s3Client.getBucketLocation(GetBucketLocationRequest.builder()
                                .bucket(bucket.name())
                                .build()).locationConstraintAsString());
                bucketRegions.put(bucket.name(), toRegion(location));
            } catch (RuntimeException e) {
                log.warn("Could not get the location of bucket {}", bucket.name(), e);
                enrichmentFailure = e;
            }
        }

        Map<String, S3StorageMetricsFetcher.StorageMetrics> metricsByRegion = new TreeMap<>();
        if (scope.getPlan().isCollectCapacityMetrics()) {
            Map<String, List<String>> bucketsByRegion = new TreeMap<>();
            bucketRegions.forEach((bucket, region) ->
                    bucketsByRegion.computeIfAbsent(region, k -> new ArrayList<>()).add(bucket));
            for (Map.Entry<String, List<String>> entry : bucketsByRegion.entrySet()) {
                S3StorageMetricsFetcher.StorageMetrics metrics = metricsFetcher.fetchMetrics(
                        scope.toBuilder().region(entry.getKey()).build(), entry.getValue());
                metricsByRegion.put(entry.getKey(), metrics);
                if (metrics.getFailure() != null) {
                    enrichmentFailure = metrics.getFailure();
                }
            }
        }

        List<S3Bucket> buckets = new ArrayList<>();
        for (Bucket bucket : fetch.getRecords()) {
            String region = bucketRegions.get(bucket.name());
            S3StorageMetricsFetcher.StorageMetrics metrics = region != null ? metricsByRegion.get(region) : null;
            buckets.add(S3Bucket.builder()
                    .id(bucket.name())
                    .region(region)
                    .creationDate(bucket.creationDate())
                    .sizeBytes(metrics != null ? metrics.getSizeBytes().get(bucket.name()) : null)
                    .objectCount(metrics != null ? metrics.getObjectCounts().get(bucket.name()) : null)
                    .build());
        }
        return CollectionResult.of(getType(), scope, fetch, buckets, enrichmentFailure);
    }

    /**
     * Buckets in us-east-1 report no location constraint and very old buckets in eu-west-1 report <code>EU</code>.
     */
    @VisibleForTesting
    static String toRegion(String locationConstraint) {
        if (!hasLength(locationConstraint)) {
            return "us-east-1";
        } else if ("EU".equals(locationConstraint)) {
            return "eu-west-1";
        }
        return locationConstraint;
    }
}
