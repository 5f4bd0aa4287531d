/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.EfsFileSystem;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.efs.model.Tag;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.stream.Collectors;

@Component
@Slf4j
public class EFSFileSystemCollector implements ResourceCollector {
    private final EFSListings efsListings;

    public EFSFileSystemCollector(EFSListings efsListings) {
        this.efsListings = efsListings;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.EFSFileSystem;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        EFSListings.Placements placements = efsListings.placements(scope);
        List<EfsFileSystem> fileSystems = placements.getFileSystems().getRecords().stream()
                .filter(fileSystem -> placements.getVpcsByFileSystem()
                        .getOrDefault(fileSystem.fileSystemId(), Collections.emptySortedSet())
                        .contains(scope.getVpcId()))
                .map(fileSystem -> {
                    SortedSet<String> vpcIds = placements.getVpcsByFileSystem().get(fileSystem.fileSystemId());
                    return EfsFileSystem.builder()
                            .id(fileSystem.fileSystemId())
                            .region(scope.getRegion())
                            .name(fileSystem.name())
                            .lifeCycleState(fileSystem.lifeCycleStateAsString())
                            .performanceMode(fileSystem.performanceModeAsString())
                            .throughputMode(fileSystem.throughputModeAsString())
                            .encrypted(fileSystem.encrypted())
                            .numberOfMountTargets(fileSystem.numberOfMountTargets())
                            .vpcIds(vpcIds)
                            .tags(TagUtil.toMap(fileSystem.tags(), Tag::key, Tag::value))
                            .sizeBytes(fileSystem.sizeInBytes() != null ? fileSystem.sizeInBytes().value() : null)
                            .build();
                })
                .collect(Collectors.toList());
        CollectionResult result = CollectionResult.of(getType(), scope, placements.getFileSystems(), fileSystems);
        return placements.getMountTargetFailure() != null
                ? result.degrade(placements.getMountTargetFailure()) : result;
    }
}
