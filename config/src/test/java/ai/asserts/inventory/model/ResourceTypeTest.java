/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static ai.asserts.inventory.model.ResourceType.EC2Instance;
import static ai.asserts.inventory.model.ResourceType.InternetGateway;
import static ai.asserts.inventory.model.ResourceType.NatGateway;
import static ai.asserts.inventory.model.ResourceType.RDSCluster;
import static ai.asserts.inventory.model.ResourceType.RDSInstance;
import static ai.asserts.inventory.model.ResourceType.RouteTable;
import static ai.asserts.inventory.model.ResourceType.S3Bucket;
import static ai.asserts.inventory.model.ResourceType.Subnet;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResourceTypeTest {
    @Test
    public void fromToken() {
        assertEquals(Optional.of(EC2Instance), ResourceType.fromToken("ec2_instances"));
        assertEquals(Optional.of(S3Bucket), ResourceType.fromToken(" S3_Buckets "));
        assertEquals(Optional.empty(), ResourceType.fromToken("ec2"));
        assertEquals(Optional.empty(), ResourceType.fromToken(null));
    }

    @Test
    public void resolve_Token() {
        assertEquals(ImmutableSet.of(RDSInstance), ResourceType.resolve("rds_instances"));
    }

    @Test
    public void resolve_Alias() {
        assertEquals(ImmutableSet.of(RDSInstance, RDSCluster), ResourceType.resolve("rds"));
        assertEquals(ImmutableSet.of(Subnet, RouteTable, InternetGateway, NatGateway),
                ResourceType.resolve("network"));
    }

    @Test
    public void resolve_Unknown() {
        assertTrue(ResourceType.resolve("lambda").isEmpty());
        assertTrue(ResourceType.resolve(null).isEmpty());
    }

    @Test
    public void inSection() {
        assertEquals(ImmutableSet.of(S3Bucket), ResourceType.inSection(ReportSection.GLOBAL_RESOURCES));
        assertTrue(ResourceType.inSection(ReportSection.VPC_RESOURCES).contains(EC2Instance));
    }

    @Test
    public void tokensAreUnique() {
        assertEquals(ResourceType.values().length,
                ImmutableSet.copyOf(java.util.Arrays.stream(ResourceType.values())
                        .map(ResourceType::getToken).iterator()).size());
    }
}
