/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.EbsVolume;
import ai.asserts.inventory.model.Ec2Instance;
import ai.asserts.inventory.model.ResourceType;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesResponse;
import software.amazon.awssdk.services.ec2.model.EbsInstanceBlockDevice;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.GroupIdentifier;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceBlockDeviceMapping;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.Volume;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static ai.asserts.inventory.collector.Ec2Filters.vpcFilter;

/**
 * Lists the instances of a VPC along with their attached EBS volumes. Volume details are looked up in batches with a
 * single <code>DescribeVolumes</code> call per batch rather than one call per volume.
 */
@Component
@Slf4j
public class EC2InstanceCollector implements ResourceCollector {
    @VisibleForTesting
    static final int VOLUME_BATCH_SIZE = 200;
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public EC2InstanceCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.EC2Instance;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(scope.getRegion());
        String api = "Ec2Client/describeInstances";
        FetchResult<Instance> fetch = fetcher.fetchAll(scope, api,
                token -> ec2Client.describeInstances(DescribeInstancesRequest.builder()
                        .filters(vpcFilter(scope))
                        .nextToken(token)
                        .build()),
                response -> response.reservations().stream()
                        .flatMap(reservation -> reservation.instances().stream())
                        .collect(Collectors.toList()),
                DescribeInstancesResponse::nextToken);

        boolean includeVolumes = !scope.getPlan().isExcluded(ResourceType.EBSVolume);
        Map<String, Volume> volumes = new HashMap<>();
        Throwable volumeFailure = null;
        if (includeVolumes && !fetch.isFailed()) {
            List<String> volumeIds = fetch.getRecords().stream()
                    .flatMap(instance -> instance.blockDeviceMappings().stream())
                    .map(InstanceBlockDeviceMapping::ebs)
                    .filter(Objects::nonNull)
                    .map(EbsInstanceBlockDevice::volumeId)
                    .filter(Objects::nonNull)
                    .distinct()
                    .collect(Collectors.toList());
            volumeFailure = describeVolumes(scope, ec2Client, volumeIds, volumes);
        }

        boolean volumeDetailsKnown = volumeFailure == null;
        List<Ec2Instance> instances = fetch.getRecords().stream()
                .map(instance -> toInstance(scope, instance, includeVolumes, volumes, volumeDetailsKnown))
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, instances, volumeFailure);
    }

    /**
     * Fills <code>volumes</code> with the details of the given volumes.
     *
     * @return the first failure, <code>null</code> if all batches succeeded
     */
    private Throwable describeVolumes(ScanScope scope, Ec2Client ec2Client, List<String> volumeIds,
                                      Map<String, Volume> volumes) {
        String api = "Ec2Client/describeVolumes";
        Throwable failure = null;
        for (List<String> batch : Lists.partition(volumeIds, VOLUME_BATCH_SIZE)) {
            Filter volumeIdFilter = Filter.builder()
                    .name("volume-id")
                    .values(batch)
                    .build();
            FetchResult<Volume> fetch = fetcher.fetchAll(scope, api,
                    token -> ec2Client.describeVolumes(DescribeVolumesRequest.builder()
                            .filters(volumeIdFilter)
                            .nextToken(token)
                            .build()),
                    DescribeVolumesResponse::volumes, DescribeVolumesResponse::nextToken);
            fetch.getRecords().forEach(volume -> volumes.put(volume.volumeId(), volume));
            if (fetch.getFailure() != null && failure == null) {
                failure = fetch.getFailure();
            }
        }
        return failure;
    }

    private Ec2Instance toInstance(ScanScope scope, Instance instance, boolean includeVolumes,
                                   Map<String, Volume> volumes, boolean volumeDetailsKnown) {
        List<EbsVolume> ebsVolumes = null;
        Long allocatedStorageGb = null;
        if (includeVolumes) {
            ebsVolumes = new ArrayList<>();
            boolean allSizesKnown = volumeDetailsKnown;
            long totalGb = 0;
            for (InstanceBlockDeviceMapping mapping : instance.blockDeviceMappings()) {
                EbsInstanceBlockDevice ebs = mapping.ebs();
                if (ebs == null || ebs.volumeId() == null) {
                    continue;
                }
                Volume volume = volumes.get(ebs.volumeId());
                if (volume == null || volume.size() == null) {
                    allSizesKnown = false;
                } else {
                    totalGb += volume.size();
                }
                ebsVolumes.add(toVolume(scope, mapping, volume));
            }
            allocatedStorageGb = allSizesKnown ? totalGb : null;
        }

        return Ec2Instance.builder()
                .id(instance.instanceId())
                .region(scope.getRegion())
                .instanceType(instance.instanceTypeAsString())
                .state(instance.state() != null ? instance.state().nameAsString() : null)
                .vpcId(instance.vpcId())
                .subnetId(instance.subnetId())
                .availabilityZone(instance.placement() != null ? instance.placement().availabilityZone() : null)
                .privateIpAddress(instance.privateIpAddress())
                .launchTime(instance.launchTime())
                .securityGroups(TagUtil.toMap(instance.securityGroups(), GroupIdentifier::groupId,
                        GroupIdentifier::groupName))
                .tags(TagUtil.toMap(instance.tags(), Tag::key, Tag::value))
                .ebsVolumes(ebsVolumes)
                .allocatedStorageGb(allocatedStorageGb)
                .build();
    }

    private EbsVolume toVolume(ScanScope scope, InstanceBlockDeviceMapping mapping, Volume volume) {
        EbsVolume.EbsVolumeBuilder<?, ?> builder = EbsVolume.builder()
                .id(mapping.ebs().volumeId())
                .region(scope.getRegion())
                .deviceName(mapping.deviceName())
                .deleteOnTermination(mapping.ebs().deleteOnTermination());
        if (volume != null) {
            builder.allocatedStorageGb(volume.size() != null ? volume.size().longValue() : null)
                    .volumeType(volume.volumeTypeAsString())
                    .iops(volume.iops())
                    .encrypted(volume.encrypted())
                    .state(volume.stateAsString());
        }
        return builder.build();
    }
}
