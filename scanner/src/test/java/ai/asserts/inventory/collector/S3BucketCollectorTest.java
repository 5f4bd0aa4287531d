/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSApiCallRateLimiter;
import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.ScanCancellation;
import ai.asserts.inventory.error.ScanErrorType;
import ai.asserts.inventory.model.S3Bucket;
import ai.asserts.inventory.model.ScanStatus;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.easymock.Capture;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.GetBucketLocationRequest;
import software.amazon.awssdk.services.s3.model.GetBucketLocationResponse;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsResponse;

import java.time.Instant;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class S3BucketCollectorTest extends EasyMockSupport {
    private AWSClientProvider awsClientProvider;
    private S3Client s3Client;
    private S3StorageMetricsFetcher metricsFetcher;
    private S3BucketCollector collector;

    @BeforeEach
    public void setup() {
        awsClientProvider = mock(AWSClientProvider.class);
        s3Client = mock(S3Client.class);
        metricsFetcher = mock(S3StorageMetricsFetcher.class);
        AWSApiCallRateLimiter rateLimiter = new AWSApiCallRateLimiter(new SimpleMeterRegistry(), 1000);
        collector = new S3BucketCollector(awsClientProvider, new PaginatedFetcher(rateLimiter,
                new ScanCancellation()), rateLimiter, metricsFetcher);
    }

    @Test
    public void toRegion() {
        assertEquals("us-east-1", S3BucketCollector.toRegion(null));
        assertEquals("us-east-1", S3BucketCollector.toRegion(""));
        assertEquals("eu-west-1", S3BucketCollector.toRegion("EU"));
        assertEquals("ap-south-1", S3BucketCollector.toRegion("ap-south-1"));
    }

    @Test
    public void collect() {
        Capture<ScanScope> usEast1 = Capture.newInstance();
        Capture<ScanScope> euWest1 = Capture.newInstance();
        expect(awsClientProvider.getS3Client("us-east-1")).andReturn(s3Client);
        expect(s3Client.listBuckets(ListBucketsRequest.builder().build())).andReturn(ListBucketsResponse.builder()
                .buckets(Bucket.builder().name("assets").creationDate(Instant.parse("2021-05-01T00:00:00Z")).build(),
                        Bucket.builder().name("logs").build())
                .build());
        expect(s3Client.getBucketLocation(GetBucketLocationRequest.builder().bucket("assets").build()))
                .andReturn(GetBucketLocationResponse.builder().build());
        expect(s3Client.getBucketLocation(GetBucketLocationRequest.builder().bucket("logs").build()))
                .andReturn(GetBucketLocationResponse.builder().locationConstraint("EU").build());
        expect(metricsFetcher.fetchMetrics(capture(euWest1), eq(ImmutableList.of("logs"))))
                .andReturn(new S3StorageMetricsFetcher.StorageMetrics(ImmutableMap.of(), ImmutableMap.of(),
                        new IllegalStateException("metrics unavailable")));
        expect(metricsFetcher.fetchMetrics(capture(usEast1), eq(ImmutableList.of("assets"))))
                .andReturn(new S3StorageMetricsFetcher.StorageMetrics(ImmutableMap.of("assets", 1024L),
                        ImmutableMap.of("assets", 10L), null));
        replayAll();

        CollectionResult result = collector.collect(TestScopes.regionScope(TestScopes.plan()));
        assertEquals("us-east-1", usEast1.getValue().getRegion());
        assertEquals("eu-west-1", euWest1.getValue().getRegion());
        assertEquals(ScanStatus.PARTIAL, result.getStatus().getStatus());
        assertEquals(ScanErrorType.METRICS_UNAVAILABLE, result.getStatus().getErrorType());
        assertEquals(2, result.getEntities().size());

        S3Bucket assets = (S3Bucket) result.getEntities().get(0);
        assertEquals("assets", assets.getId());
        assertEquals("us-east-1", assets.getRegion());
        assertEquals(1024L, assets.getSizeBytes());
        assertEquals(10L, assets.getObjectCount());

        S3Bucket logs = (S3Bucket) result.getEntities().get(1);
        assertEquals("eu-west-1", logs.getRegion());
        assertNull(logs.getSizeBytes());
        verifyAll();
    }

    @Test
    public void collect_capacityMetricsDisabled() {
        expect(awsClientProvider.getS3Client("us-east-1")).andReturn(s3Client);
        expect(s3Client.listBuckets(ListBucketsRequest.builder().build())).andReturn(ListBucketsResponse.builder()
                .buckets(Bucket.builder().name("assets").build())
                .build());
        expect(s3Client.getBucketLocation(anyObject(GetBucketLocationRequest.class)))
                .andReturn(GetBucketLocationResponse.builder().locationConstraint("us-west-2").build());
        replayAll();

        CollectionResult result = collector.collect(TestScopes.regionScope(TestScopes.plan(false)));
        assertEquals(ScanStatus.COMPLETE, result.getStatus().getStatus());
        assertEquals("us-west-2", result.getEntities().get(0).getRegion());
        assertTrue(result.getEntities().stream().allMatch(bucket -> bucket.getSizeBytes() == null));
        verifyAll();
    }
}
