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

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RdsCluster extends ResourceEntity {
    private final String vpcId;
    private final String engine;
    private final String engineVersion;
    private final String status;
    private final String dbSubnetGroup;
    private final List<RdsClusterMember> members;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.RDSCluster;
    }
}
