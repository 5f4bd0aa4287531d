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
public class FsxFileSystem extends ResourceEntity {
    private final String vpcId;
    private final String fileSystemType;
    private final String lifecycle;
    private final String storageType;
    private final List<String> subnetIds;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.FSxFileSystem;
    }
}
