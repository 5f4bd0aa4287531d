/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.RdsInstance;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.rds.model.DBInstance;

import java.util.ArrayList;
import java.util.List;

import static org.springframework.util.StringUtils.hasLength;

/**
 * The VPC of an instance comes from the subnet group embedded in the instance. Only instances without one are looked
 * up in the region's subnet group listing.
 */
@Component
@Slf4j
public class RDSInstanceCollector implements ResourceCollector {
    private final RDSListings rdsListings;

    public RDSInstanceCollector(RDSListings rdsListings) {
        this.rdsListings = rdsListings;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.RDSInstance;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        FetchResult<DBInstance> fetch = rdsListings.dbInstances(scope);
        List<RdsInstance> instances = new ArrayList<>();
        Throwable placementFailure = null;
        for (DBInstance dbInstance : fetch.getRecords()) {
            String vpcId = null;
            String subnetGroupName = null;
            if (dbInstance.dbSubnetGroup() != null) {
                vpcId = dbInstance.dbSubnetGroup().vpcId();
                subnetGroupName = dbInstance.dbSubnetGroup().dbSubnetGroupName();
            }
            if (!hasLength(vpcId) && hasLength(subnetGroupName)) {
                RDSListings.SubnetGroups subnetGroups = rdsListings.subnetGroups(scope);
                vpcId = subnetGroups.vpcOf(subnetGroupName);
                if (vpcId == null && subnetGroups.getFailure() != null) {
                    placementFailure = subnetGroups.getFailure();
                }
            }
            if (scope.getVpcId().equals(vpcId)) {
                instances.add(RdsInstance.builder()
                        .id(dbInstance.dbInstanceIdentifier())
                        .region(scope.getRegion())
                        .vpcId(vpcId)
                        .engine(dbInstance.engine())
                        .engineVersion(dbInstance.engineVersion())
                        .instanceClass(dbInstance.dbInstanceClass())
                        .status(dbInstance.dbInstanceStatus())
                        .multiAz(dbInstance.multiAZ())
                        .storageType(dbInstance.storageType())
                        .dbSubnetGroup(subnetGroupName)
                        .clusterId(dbInstance.dbClusterIdentifier())
                        .allocatedStorageGb(dbInstance.allocatedStorage() != null
                                ? dbInstance.allocatedStorage().longValue() : null)
                        .build());
            }
        }
        CollectionResult result = CollectionResult.of(getType(), scope, fetch, instances);
        return placementFailure != null ? result.degrade(placementFailure) : result;
    }
}
