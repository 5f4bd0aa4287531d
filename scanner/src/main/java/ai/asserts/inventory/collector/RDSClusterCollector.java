/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.RdsCluster;
import ai.asserts.inventory.model.RdsClusterMember;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.rds.model.DBCluster;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Clusters only name their subnet group, so they are placed through the region's subnet group listing.
 */
@Component
@Slf4j
public class RDSClusterCollector implements ResourceCollector {
    private final RDSListings rdsListings;

    public RDSClusterCollector(RDSListings rdsListings) {
        this.rdsListings = rdsListings;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.RDSCluster;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        FetchResult<DBCluster> fetch = rdsListings.dbClusters(scope);
        if (fetch.isFailed()) {
            return CollectionResult.of(getType(), scope, fetch, List.of());
        }
        RDSListings.SubnetGroups subnetGroups = rdsListings.subnetGroups(scope);
        if (subnetGroups.getGroupVpcs().isEmpty() && subnetGroups.getFailure() != null
                && !fetch.getRecords().isEmpty()) {
            return CollectionResult.failed(getType(), subnetGroups.getFailure());
        }
        List<RdsCluster> clusters = fetch.getRecords().stream()
                .filter(cluster -> scope.getVpcId().equals(subnetGroups.vpcOf(cluster.dbSubnetGroup())))
                .map(cluster -> RdsCluster.builder()
                        .id(cluster.dbClusterIdentifier())
                        .region(scope.getRegion())
                        .vpcId(scope.getVpcId())
                        .engine(cluster.engine())
                        .engineVersion(cluster.engineVersion())
                        .status(cluster.status())
                        .dbSubnetGroup(cluster.dbSubnetGroup())
                        .members(cluster.dbClusterMembers().stream()
                                .map(member -> new RdsClusterMember(member.dbInstanceIdentifier(),
                                        Boolean.TRUE.equals(member.isClusterWriter())))
                                .collect(Collectors.toList()))
                        .allocatedStorageGb(cluster.allocatedStorage() != null
                                ? cluster.allocatedStorage().longValue() : null)
                        .build())
                .collect(Collectors.toList());
        CollectionResult result = CollectionResult.of(getType(), scope, fetch, clusters);
        return subnetGroups.getFailure() != null ? result.degrade(subnetGroups.getFailure()) : result;
    }
}
