/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSApiCallRateLimiter;
import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.ScanCancellation;
import ai.asserts.inventory.model.EfsFileSystem;
import ai.asserts.inventory.model.ScanStatus;
import com.google.common.collect.ImmutableSortedSet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.efs.EfsClient;
import software.amazon.awssdk.services.efs.model.DescribeFileSystemsRequest;
import software.amazon.awssdk.services.efs.model.DescribeFileSystemsResponse;
import software.amazon.awssdk.services.efs.model.DescribeMountTargetsRequest;
import software.amazon.awssdk.services.efs.model.DescribeMountTargetsResponse;
import software.amazon.awssdk.services.efs.model.EfsException;
import software.amazon.awssdk.services.efs.model.FileSystemDescription;
import software.amazon.awssdk.services.efs.model.FileSystemSize;
import software.amazon.awssdk.services.efs.model.LifeCycleState;
import software.amazon.awssdk.services.efs.model.MountTargetDescription;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EFSFileSystemCollectorTest extends EasyMockSupport {
    private AWSClientProvider awsClientProvider;
    private EfsClient efsClient;
    private EFSFileSystemCollector collector;
    private ScanScope regionScope;

    @BeforeEach
    public void setup() {
        awsClientProvider = mock(AWSClientProvider.class);
        efsClient = mock(EfsClient.class);
        PaginatedFetcher fetcher = new PaginatedFetcher(new AWSApiCallRateLimiter(new SimpleMeterRegistry(), 1000),
                new ScanCancellation());
        collector = new EFSFileSystemCollector(new EFSListings(awsClientProvider, fetcher));
        regionScope = TestScopes.regionScope(TestScopes.plan());
    }

    @Test
    public void collect_placedByMountTargets() {
        expect(awsClientProvider.getEfsClient("us-east-1")).andReturn(efsClient);
        expect(efsClient.describeFileSystems(DescribeFileSystemsRequest.builder().build()))
                .andReturn(DescribeFileSystemsResponse.builder()
                        .fileSystems(fileSystem("fs-1"), fileSystem("fs-2"))
                        .build());
        expect(efsClient.describeMountTargets(DescribeMountTargetsRequest.builder().fileSystemId("fs-1").build()))
                .andReturn(DescribeMountTargetsResponse.builder()
                        .mountTargets(mountTarget("vpc-abc"), mountTarget("vpc-other"))
                        .build());
        expect(efsClient.describeMountTargets(DescribeMountTargetsRequest.builder().fileSystemId("fs-2").build()))
                .andReturn(DescribeMountTargetsResponse.builder()
                        .mountTargets(mountTarget("vpc-other"))
                        .build());
        replayAll();

        CollectionResult abc = collector.collect(regionScope.forVpc("vpc-abc"));
        assertEquals(ScanStatus.COMPLETE, abc.getStatus().getStatus());
        assertEquals(1, abc.getEntities().size());
        EfsFileSystem fs1 = (EfsFileSystem) abc.getEntities().get(0);
        assertEquals("fs-1", fs1.getId());
        assertEquals(4096L, fs1.getSizeBytes());
        assertEquals("available", fs1.getLifeCycleState());
        assertEquals(ImmutableSortedSet.of("vpc-abc", "vpc-other"), fs1.getVpcIds());

        // Same region, listings are not fetched again
        CollectionResult other = collector.collect(regionScope.forVpc("vpc-other"));
        assertEquals(2, other.getEntities().size());

        CollectionResult empty = collector.collect(regionScope.forVpc("vpc-none"));
        assertTrue(empty.getEntities().isEmpty());
        assertEquals(ScanStatus.COMPLETE, empty.getStatus().getStatus());
        verifyAll();
    }

    @Test
    public void collect_mountTargetsFail() {
        expect(awsClientProvider.getEfsClient("us-east-1")).andReturn(efsClient);
        expect(efsClient.describeFileSystems(DescribeFileSystemsRequest.builder().build()))
                .andReturn(DescribeFileSystemsResponse.builder()
                        .fileSystems(fileSystem("fs-1"))
                        .build());
        expect(efsClient.describeMountTargets(DescribeMountTargetsRequest.builder().fileSystemId("fs-1").build()))
                .andThrow(EfsException.builder().statusCode(500).message("unavailable").build());
        replayAll();

        CollectionResult result = collector.collect(regionScope.forVpc("vpc-abc"));
        assertTrue(result.getEntities().isEmpty());
        assertEquals(ScanStatus.PARTIAL, result.getStatus().getStatus());
        verifyAll();
    }

    private FileSystemDescription fileSystem(String id) {
        return FileSystemDescription.builder()
                .fileSystemId(id)
                .name(id + "-name")
                .lifeCycleState(LifeCycleState.AVAILABLE)
                .encrypted(true)
                .numberOfMountTargets(1)
                .sizeInBytes(FileSystemSize.builder().value(4096L).build())
                .build();
    }

    private MountTargetDescription mountTarget(String vpcId) {
        return MountTargetDescription.builder()
                .mountTargetId("fsmt-" + vpcId)
                .vpcId(vpcId)
                .build();
    }
}
