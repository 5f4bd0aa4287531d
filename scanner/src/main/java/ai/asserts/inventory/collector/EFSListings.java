/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.efs.EfsClient;
import software.amazon.awssdk.services.efs.model.DescribeFileSystemsRequest;
import software.amazon.awssdk.services.efs.model.DescribeFileSystemsResponse;
import software.amazon.awssdk.services.efs.model.DescribeMountTargetsRequest;
import software.amazon.awssdk.services.efs.model.DescribeMountTargetsResponse;
import software.amazon.awssdk.services.efs.model.FileSystemDescription;
import software.amazon.awssdk.services.efs.model.MountTargetDescription;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * File systems are not tied to a VPC, their mount targets are. The file systems of a region and the VPCs of their
 * mount targets are listed once per region.
 */
@Component
@Slf4j
public class EFSListings {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public EFSListings(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    public Placements placements(ScanScope scope) {
        return scope.getRegionCache().getEfsPlacements().get(() -> {
            EfsClient efsClient = awsClientProvider.getEfsClient(scope.getRegion());
            FetchResult<FileSystemDescription> fileSystems = fetcher.fetchAll(scope, "EfsClient/describeFileSystems",
                    token -> efsClient.describeFileSystems(DescribeFileSystemsRequest.builder()
                            .marker(token)
                            .build()),
                    DescribeFileSystemsResponse::fileSystems, DescribeFileSystemsResponse::nextMarker);
            Map<String, SortedSet<String>> vpcsByFileSystem = new HashMap<>();
            Throwable mountTargetFailure = null;
            for (FileSystemDescription fileSystem : fileSystems.getRecords()) {
                FetchResult<MountTargetDescription> mountTargets = fetcher.fetchAll(scope,
                        "EfsClient/describeMountTargets",
                        token -> efsClient.describeMountTargets(DescribeMountTargetsRequest.builder()
                                .fileSystemId(fileSystem.fileSystemId())
                                .marker(token)
                                .build()),
                        DescribeMountTargetsResponse::mountTargets, DescribeMountTargetsResponse::nextMarker);
                SortedSet<String> vpcIds = new TreeSet<>();
                mountTargets.getRecords().forEach(mountTarget -> vpcIds.add(mountTarget.vpcId()));
                vpcsByFileSystem.put(fileSystem.fileSystemId(), vpcIds);
                if (mountTargets.getFailure() != null) {
                    log.warn("Could not list mount targets of {} in {}", fileSystem.fileSystemId(), scope);
                    mountTargetFailure = mountTargets.getFailure();
                }
            }
            return new Placements(fileSystems, vpcsByFileSystem, mountTargetFailure);
        });
    }

    @Getter
    @AllArgsConstructor
    public static class Placements {
        private final FetchResult<FileSystemDescription> fileSystems;
        private final Map<String, SortedSet<String>> vpcsByFileSystem;
        private final Throwable mountTargetFailure;
    }
}
