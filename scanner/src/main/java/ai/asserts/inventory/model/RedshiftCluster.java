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
public class RedshiftCluster extends ResourceEntity {
    private final String vpcId;
    private final String nodeType;
    private final Integer numberOfNodes;
    private final String status;
    private final String dbName;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.RedshiftCluster;
    }
}
