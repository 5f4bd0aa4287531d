/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Ec2Instance extends ResourceEntity {
    private final String instanceType;
    private final String state;
    private final String vpcId;
    private final String subnetId;
    private final String availabilityZone;
    private final String privateIpAddress;
    private final Instant launchTime;
    /**
     * Security group id to group name.
     */
    private final SortedMap<String, String> securityGroups;
    private final SortedMap<String, String> tags;
    private final List<EbsVolume> ebsVolumes;

    @Override
    public List<EbsVolume> nestedEntities() {
        return ebsVolumes != null ? ebsVolumes : List.of();
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.EC2Instance;
    }
}
