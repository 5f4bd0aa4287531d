/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSApiCallRateLimiter;
import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.ScanCancellation;
import ai.asserts.inventory.model.ScanStatus;
import ai.asserts.inventory.model.Subnet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.SubnetState;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SubnetCollectorTest extends EasyMockSupport {
    private AWSClientProvider awsClientProvider;
    private Ec2Client ec2Client;
    private SubnetCollector collector;

    @BeforeEach
    public void setup() {
        awsClientProvider = mock(AWSClientProvider.class);
        ec2Client = mock(Ec2Client.class);
        collector = new SubnetCollector(awsClientProvider,
                new PaginatedFetcher(new AWSApiCallRateLimiter(new SimpleMeterRegistry(), 1000),
                        new ScanCancellation()));
    }

    @Test
    public void collect_twoPages() {
        expect(awsClientProvider.getEc2Client("us-east-1")).andReturn(ec2Client);
        expect(ec2Client.describeSubnets(request(null))).andReturn(DescribeSubnetsResponse.builder()
                .subnets(subnet("subnet-1"))
                .nextToken("page-2")
                .build());
        expect(ec2Client.describeSubnets(request("page-2"))).andReturn(DescribeSubnetsResponse.builder()
                .subnets(subnet("subnet-2"))
                .build());
        replayAll();

        CollectionResult result = collector.collect(TestScopes.vpcScope(TestScopes.plan(), "vpc-abc"));
        assertEquals(ScanStatus.COMPLETE, result.getStatus().getStatus());
        assertEquals(2, result.getEntities().size());
        Subnet subnet = (Subnet) result.getEntities().get(1);
        assertEquals("subnet-2", subnet.getId());
        assertEquals("us-east-1", subnet.getRegion());
        assertEquals("10.0.1.0/24", subnet.getCidrBlock());
        assertEquals("us-east-1b", subnet.getAvailabilityZone());
        assertEquals("available", subnet.getState());
        assertEquals(250, subnet.getAvailableIpAddressCount());
        assertTrue(subnet.getMapPublicIpOnLaunch());
        assertNull(subnet.getTags());
        verifyAll();
    }

    private DescribeSubnetsRequest request(String token) {
        return DescribeSubnetsRequest.builder()
                .filters(Filter.builder()
                        .name("vpc-id")
                        .values("vpc-abc")
                        .build())
                .nextToken(token)
                .build();
    }

    private software.amazon.awssdk.services.ec2.model.Subnet subnet(String id) {
        return software.amazon.awssdk.services.ec2.model.Subnet.builder()
                .subnetId(id)
                .vpcId("vpc-abc")
                .cidrBlock("10.0.1.0/24")
                .availabilityZone("us-east-1b")
                .state(SubnetState.AVAILABLE)
                .availableIpAddressCount(250)
                .mapPublicIpOnLaunch(true)
                .build();
    }
}
