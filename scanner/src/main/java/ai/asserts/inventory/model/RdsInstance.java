/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RdsInstance extends ResourceEntity {
    private final String vpcId;
    private final String engine;
    private final String engineVersion;
    private final String instanceClass;
    private final String status;
    private final Boolean multiAz;
    private final String storageType;
    private final String dbSubnetGroup;
    private final String clusterId;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.RDSInstance;
    }
}
