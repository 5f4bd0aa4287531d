/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.ReportSection;
import ai.asserts.inventory.model.ResourceType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CollectorRegistryTest extends EasyMockSupport {
    private ResourceCollector ec2Collector;
    private ResourceCollector rdsCollector;
    private ResourceCollector subnetCollector;
    private ResourceCollector s3Collector;

    @BeforeEach
    public void setup() {
        ec2Collector = collector(ResourceType.EC2Instance);
        rdsCollector = collector(ResourceType.RDSInstance);
        subnetCollector = collector(ResourceType.Subnet);
        s3Collector = collector(ResourceType.S3Bucket);
    }

    @Test
    public void collectorsFor() {
        replayAll();
        CollectorRegistry registry = new CollectorRegistry(ImmutableList.of(rdsCollector, s3Collector,
                subnetCollector, ec2Collector));
        assertEquals(ImmutableList.of(subnetCollector, ec2Collector, rdsCollector), registry.collectorsFor(
                TestScopes.plan(), ImmutableSet.of(ReportSection.NETWORK_COMPONENTS, ReportSection.VPC_RESOURCES)));
        assertEquals(ImmutableList.of(s3Collector), registry.collectorsFor(TestScopes.plan(),
                ImmutableSet.of(ReportSection.GLOBAL_RESOURCES)));
        verifyAll();
    }

    @Test
    public void collectorsFor_excluded() {
        replayAll();
        CollectorRegistry registry = new CollectorRegistry(ImmutableList.of(rdsCollector, s3Collector,
                subnetCollector, ec2Collector));
        assertEquals(ImmutableList.of(subnetCollector, ec2Collector), registry.collectorsFor(
                TestScopes.plan(ResourceType.RDSInstance),
                ImmutableSet.of(ReportSection.NETWORK_COMPONENTS, ReportSection.VPC_RESOURCES)));
        assertTrue(registry.collectorsFor(TestScopes.plan(ResourceType.S3Bucket),
                ImmutableSet.of(ReportSection.GLOBAL_RESOURCES)).isEmpty());
        assertEquals(ec2Collector, registry.getCollector(ResourceType.EC2Instance).orElse(null));
        assertTrue(registry.getCollector(ResourceType.FSxFileSystem).isEmpty());
        verifyAll();
    }

    @Test
    public void duplicateCollector() {
        ResourceCollector another = collector(ResourceType.EC2Instance);
        replayAll();
        assertThrows(IllegalStateException.class, () -> new CollectorRegistry(ImmutableList.of(ec2Collector,
                another)));
    }

    private ResourceCollector collector(ResourceType type) {
        ResourceCollector collector = mock(type.name(), ResourceCollector.class);
        expect(collector.getType()).andReturn(type).anyTimes();
        return collector;
    }
}
