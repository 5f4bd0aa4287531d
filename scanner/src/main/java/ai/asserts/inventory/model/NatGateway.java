/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;
import java.util.SortedMap;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class NatGateway extends ResourceEntity {
    private final String vpcId;
    private final String subnetId;
    private final String state;
    private final String connectivityType;
    private final List<String> publicIps;
    private final List<String> privateIps;
    private final SortedMap<String, String> tags;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.NatGateway;
    }
}
