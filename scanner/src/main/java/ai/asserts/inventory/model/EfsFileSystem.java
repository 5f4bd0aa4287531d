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
import java.util.SortedSet;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EfsFileSystem extends ResourceEntity {
    private final String name;
    private final String lifeCycleState;
    private final String performanceMode;
    private final String throughputMode;
    private final Boolean encrypted;
    private final Integer numberOfMountTargets;
    private final SortedSet<String> vpcIds;
    private final SortedMap<String, String> tags;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.EFSFileSystem;
    }
}
