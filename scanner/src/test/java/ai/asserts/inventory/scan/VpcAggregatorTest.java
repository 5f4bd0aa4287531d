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
import ai.asserts.inventory.collector.ResourceCollector;
import ai.asserts.inventory.collector.ScanScope;
import ai.asserts.inventory.collector.TestScopes;
import ai.asserts.inventory.error.ScanErrorType;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.RdsInstance;
import ai.asserts.inventory.model.ResourceEntity;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.ScanStatus;
import ai.asserts.inventory.model.SecurityGroup;
import ai.asserts.inventory.model.Subnet;
import ai.asserts.inventory.model.VpcInfo;
import ai.asserts.inventory.model.VpcReport;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VpcAggregatorTest extends EasyMockSupport {
    private final VpcInfo vpcInfo = VpcInfo.builder()
            .vpcId("vpc-abc")
            .cidrBlock("10.0.0.0/16")
            .state("available")
            .defaultVpc(false)
            .build();
    private ResourceCollector subnetCollector;
    private ResourceCollector securityGroupCollector;
    private ResourceCollector ec2Collector;
    private ResourceCollector rdsCollector;

    @BeforeEach
    public void setup() {
        subnetCollector = collector(ResourceType.Subnet);
        securityGroupCollector = collector(ResourceType.SecurityGroup);
        ec2Collector = collector(ResourceType.EC2Instance);
        rdsCollector = collector(ResourceType.RDSInstance);
    }

    @Test
    public void aggregate_collectorFailureIsIsolated() {
        ScanScope scope = TestScopes.vpcScope(TestScopes.plan(), "vpc-abc");
        expect(subnetCollector.collect(scope)).andReturn(complete(ResourceType.Subnet, Subnet.builder()
                .id("subnet-1").region("us-east-1").vpcId("vpc-abc").build()));
        expect(securityGroupCollector.collect(scope)).andReturn(complete(ResourceType.SecurityGroup,
                SecurityGroup.builder().id("sg-1").region("us-east-1").vpcId("vpc-abc").build()));
        expect(ec2Collector.collect(scope)).andThrow(new IllegalStateException("boom"));
        expect(rdsCollector.collect(scope)).andReturn(complete(ResourceType.RDSInstance, RdsInstance.builder()
                .id("db-1").region("us-east-1").vpcId("vpc-abc").build()));
        replayAll();

        VpcReport report = vpcAggregator().aggregate(scope, vpcInfo);
        assertSame(vpcInfo, report.getVpcInfo());
        assertEquals(ImmutableSet.of("subnets"), report.getNetworkComponents().keySet());
        assertEquals(1, report.getSecurityGroups().size());
        assertEquals(ImmutableSet.of("rds_instances"), report.getResources().keySet());
        assertFalse(report.getResources().containsKey("ec2_instances"));

        assertEquals(ScanStatus.PARTIAL, report.getScanStatus().getStatus());
        CollectorStatus ec2Status = report.getScanStatus().getCollectors().get("ec2_instances");
        assertEquals(ScanStatus.FAILED, ec2Status.getStatus());
        assertEquals(ScanErrorType.UNKNOWN, ec2Status.getErrorType());
        assertEquals(ScanStatus.COMPLETE, report.getScanStatus().getCollectors().get("rds_instances").getStatus());
        assertEquals(ScanStatus.PARTIAL, VpcAggregator.statusOf(report));
        verifyAll();
    }

    @Test
    public void aggregate_excludedTypesAbsent() {
        ScanScope scope = TestScopes.vpcScope(TestScopes.plan(ResourceType.SecurityGroup, ResourceType.RDSInstance,
                ResourceType.Subnet), "vpc-abc");
        expect(ec2Collector.collect(scope)).andReturn(complete(ResourceType.EC2Instance));
        replayAll();

        VpcReport report = vpcAggregator().aggregate(scope, vpcInfo);
        assertTrue(report.getNetworkComponents().isEmpty());
        assertNull(report.getSecurityGroups());
        assertEquals(ImmutableSet.of("ec2_instances"), report.getResources().keySet());
        assertTrue(report.getResources().get("ec2_instances").isEmpty());
        assertEquals(ImmutableSet.of("ec2_instances"), report.getScanStatus().getCollectors().keySet());
        assertEquals(ScanStatus.COMPLETE, report.getScanStatus().getStatus());
        verifyAll();
    }

    private VpcAggregator vpcAggregator() {
        return new VpcAggregator(new CollectorRegistry(ImmutableList.of(subnetCollector, securityGroupCollector,
                ec2Collector, rdsCollector)), new TestTaskExecutorUtil(new ScanCancellation()),
                new TestTaskThreadPool());
    }

    private CollectionResult complete(ResourceType type, ResourceEntity... entities) {
        return CollectionResult.builder()
                .type(type)
                .entities(List.of(entities))
                .status(CollectorStatus.complete())
                .build();
    }

    private ResourceCollector collector(ResourceType type) {
        ResourceCollector collector = mock(type.name(), ResourceCollector.class);
        expect(collector.getType()).andReturn(type).anyTimes();
        return collector;
    }
}
