/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.SortedMap;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Subnet extends ResourceEntity {
    private final String vpcId;
    private final String cidrBlock;
    private final String availabilityZone;
    private final String state;
    private final Integer availableIpAddressCount;
    private final Boolean mapPublicIpOnLaunch;
    private final SortedMap<String, String> tags;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.Subnet;
    }
}
