/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.scan;

import ai.asserts.inventory.ScanCancellation;
import ai.asserts.inventory.TestTaskExecutorUtil;
import ai.asserts.inventory.TestTaskThreadPool;
import ai.asserts.inventory.collector.CollectionResult;
import ai.asserts.inventory.collector.CollectorRegistry;
import ai.asserts.inventory.collector.FetchResult;
import ai.asserts.inventory.collector.ResourceCollector;
import ai.asserts.inventory.collector.ScanPlan;
import ai.asserts.inventory.collector.ScanScope;
import ai.asserts.inventory.collector.TestScopes;
import ai.asserts.inventory.collector.VpcFetcher;
import ai.asserts.inventory.error.ScanErrorType;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.DynamoDbTable;
import ai.asserts.inventory.model.RegionReport;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.ScanStatus;
import ai.asserts.inventory.model.ScopeStatus;
import ai.asserts.inventory.model.VpcInfo;
import ai.asserts.inventory.model.VpcReport;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;

import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RegionOrchestratorTest extends EasyMockSupport {
    private VpcFetcher vpcFetcher;
    private VpcAggregator vpcAggregator;
    private ResourceCollector dynamoCollector;
    private final ScanPlan plan = TestScopes.plan();

    @BeforeEach
    public void setup() {
        vpcFetcher = mock(VpcFetcher.class);
        vpcAggregator = mock(VpcAggregator.class);
        dynamoCollector = mock(ResourceCollector.class);
        expect(dynamoCollector.getType()).andReturn(ResourceType.DynamoDBTable).anyTimes();
    }

    @Test
    public void scanRegion_noVpcs() {
        expect(vpcFetcher.fetchVpcs(anyObject(ScanScope.class))).andReturn(vpcs(Collections.emptyList(), 1, null));
        expect(dynamoCollector.collect(anyObject(ScanScope.class))).andReturn(tables());
        replayAll();

        RegionReport report = regionOrchestrator().scanRegion(plan, "us-east-1");
        assertEquals("us-east-1", report.getRegion());
        assertTrue(report.getVpcs().isEmpty());
        assertEquals(ImmutableSet.of("dynamodb_tables"), report.getRegionWide().keySet());
        assertEquals(1, report.getRegionWide().get("dynamodb_tables").size());
        assertEquals(ScanStatus.COMPLETE, report.getScanStatus().getStatus());
        assertEquals(ImmutableSet.of("dynamodb_tables", "vpcs"), report.getScanStatus().getCollectors().keySet());
        verifyAll();
    }

    @Test
    public void scanRegion_regionNotEnabled() {
        expect(vpcFetcher.fetchVpcs(anyObject(ScanScope.class))).andReturn(vpcs(Collections.emptyList(), 0,
                ec2Exception("AuthFailure", 401)));
        replayAll();

        RegionReport report = regionOrchestrator().scanRegion(plan, "ap-east-1");
        assertEquals("ap-east-1", report.getRegion());
        assertNull(report.getRegionWide());
        assertTrue(report.getVpcs().isEmpty());
        assertEquals(ScanStatus.FAILED, report.getScanStatus().getStatus());
        assertEquals(ScanErrorType.NOT_ENABLED, report.getScanStatus().getErrorType());
        CollectorStatus discovery = report.getScanStatus().getCollectors().get(RegionOrchestrator.VPC_DISCOVERY);
        assertEquals(ScanStatus.FAILED, discovery.getStatus());
        verifyAll();
    }

    @Test
    public void scanRegion_vpcDiscoveryDenied() {
        expect(vpcFetcher.fetchVpcs(anyObject(ScanScope.class))).andReturn(vpcs(Collections.emptyList(), 0,
                ec2Exception("UnauthorizedOperation", 403)));
        expect(dynamoCollector.collect(anyObject(ScanScope.class))).andReturn(tables());
        replayAll();

        RegionReport report = regionOrchestrator().scanRegion(plan, "us-east-1");
        assertEquals(ScanStatus.PARTIAL, report.getScanStatus().getStatus());
        assertEquals(1, report.getRegionWide().get("dynamodb_tables").size());
        CollectorStatus discovery = report.getScanStatus().getCollectors().get(RegionOrchestrator.VPC_DISCOVERY);
        assertEquals(ScanStatus.FAILED, discovery.getStatus());
        assertEquals(ScanErrorType.ACCESS_DENIED, discovery.getErrorType());
        verifyAll();
    }

    @Test
    public void scanRegion_vpcAggregationFails() {
        VpcInfo healthy = VpcInfo.builder().vpcId("vpc-abc").build();
        VpcInfo broken = VpcInfo.builder().vpcId("vpc-def").build();
        VpcReport healthyReport = VpcReport.builder()
                .vpcInfo(healthy)
                .scanStatus(ScopeStatus.builder()
                        .status(ScanStatus.COMPLETE)
                        .collectors(new TreeMap<>())
                        .build())
                .build();
        VpcReport brokenReport = VpcReport.builder()
                .vpcInfo(broken)
                .scanStatus(ScopeStatus.builder()
                        .status(ScanStatus.FAILED)
                        .errorType(ScanErrorType.UNKNOWN)
                        .build())
                .build();

        expect(vpcFetcher.fetchVpcs(anyObject(ScanScope.class))).andReturn(vpcs(List.of(healthy, broken), 1,
                null));
        expect(dynamoCollector.collect(anyObject(ScanScope.class))).andReturn(tables());
        expect(vpcAggregator.aggregate(anyObject(ScanScope.class), eq(healthy))).andReturn(healthyReport);
        expect(vpcAggregator.aggregate(anyObject(ScanScope.class), eq(broken)))
                .andThrow(new IllegalStateException("boom"));
        expect(vpcAggregator.failed(eq(broken), anyObject(ScopeStatus.class))).andReturn(brokenReport);
        replayAll();

        RegionReport report = regionOrchestrator().scanRegion(plan, "us-east-1");
        assertEquals(ImmutableSet.of("vpc-abc", "vpc-def"), report.getVpcs().keySet());
        assertSame(healthyReport, report.getVpcs().get("vpc-abc"));
        assertSame(brokenReport, report.getVpcs().get("vpc-def"));
        assertEquals(ScanStatus.PARTIAL, report.getScanStatus().getStatus());
        verifyAll();
    }

    @Test
    public void scanRegion_regionWideExcluded() {
        expect(vpcFetcher.fetchVpcs(anyObject(ScanScope.class))).andReturn(vpcs(Collections.emptyList(), 1, null));
        replayAll();

        RegionReport report = regionOrchestrator().scanRegion(TestScopes.plan(ResourceType.DynamoDBTable),
                "us-east-1");
        assertTrue(report.getRegionWide().isEmpty());
        assertEquals(ImmutableSet.of("vpcs"), report.getScanStatus().getCollectors().keySet());
        assertEquals(ScanStatus.COMPLETE, report.getScanStatus().getStatus());
        verifyAll();
    }

    @Test
    public void failed() {
        CollectorStatus cause = CollectorStatus.builder()
                .status(ScanStatus.CANCELLED)
                .errorType(ScanErrorType.CANCELLED)
                .build();
        replayAll();
        RegionReport report = regionOrchestrator().failed("us-west-2", cause);
        assertEquals(ScanStatus.CANCELLED, report.getScanStatus().getStatus());
        assertEquals(cause, report.getScanStatus().getCollectors().get("vpcs"));
        assertNull(report.getRegionWide());
    }

    private RegionOrchestrator regionOrchestrator() {
        TestTaskThreadPool pool = new TestTaskThreadPool();
        return new RegionOrchestrator(vpcFetcher, vpcAggregator,
                new CollectorRegistry(ImmutableList.of(dynamoCollector)),
                new TestTaskExecutorUtil(new ScanCancellation()), pool, pool);
    }

    private FetchResult<VpcInfo> vpcs(List<VpcInfo> records, int pages, Throwable failure) {
        return FetchResult.<VpcInfo>builder()
                .records(records)
                .pages(pages)
                .failure(failure)
                .build();
    }

    private CollectionResult tables() {
        return CollectionResult.builder()
                .type(ResourceType.DynamoDBTable)
                .entities(List.of(DynamoDbTable.builder()
                        .id("orders")
                        .region("us-east-1")
                        .build()))
                .status(CollectorStatus.complete())
                .build();
    }

    private AwsServiceException ec2Exception(String errorCode, int statusCode) {
        return Ec2Exception.builder()
                .statusCode(statusCode)
                .awsErrorDetails(AwsErrorDetails.builder()
                        .errorCode(errorCode)
                        .errorMessage("not allowed")
                        .build())
                .build();
    }
}
