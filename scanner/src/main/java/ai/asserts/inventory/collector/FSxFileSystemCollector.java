/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.FsxFileSystem;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.fsx.FSxClient;
import software.amazon.awssdk.services.fsx.model.DescribeFileSystemsRequest;
import software.amazon.awssdk.services.fsx.model.DescribeFileSystemsResponse;
import software.amazon.awssdk.services.fsx.model.FileSystem;

import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
public class FSxFileSystemCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public FSxFileSystemCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.FSxFileSystem;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        FetchResult<FileSystem> fetch = scope.getRegionCache().getFsxFileSystems().get(() -> {
            FSxClient fsxClient = awsClientProvider.getFSxClient(scope.getRegion());
            return fetcher.fetchAll(scope, "FSxClient/describeFileSystems",
                    token -> fsxClient.describeFileSystems(DescribeFileSystemsRequest.builder()
                            .nextToken(token)
                            .build()),
                    DescribeFileSystemsResponse::fileSystems, DescribeFileSystemsResponse::nextToken);
        });
        List<FsxFileSystem> fileSystems = fetch.getRecords().stream()
                .filter(fileSystem -> scope.getVpcId().equals(fileSystem.vpcId()))
                .map(fileSystem -> FsxFileSystem.builder()
                        .id(fileSystem.fileSystemId())
                        .region(scope.getRegion())
                        .vpcId(fileSystem.vpcId())
                        .fileSystemType(fileSystem.fileSystemTypeAsString())
                        .lifecycle(fileSystem.lifecycleAsString())
                        .storageType(fileSystem.storageTypeAsString())
                        .subnetIds(fileSystem.subnetIds())
                        .allocatedStorageGb(fileSystem.storageCapacity() != null
                                ? fileSystem.storageCapacity().longValue() : null)
                        .build())
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, fileSystems);
    }
}
