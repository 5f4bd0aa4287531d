/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.report;

import ai.asserts.inventory.model.AccountInventory;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.RegionReport;
import ai.asserts.inventory.model.ResourceEntity;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.ScanStatus;
import ai.asserts.inventory.model.ScopeStatus;
import ai.asserts.inventory.model.VpcReport;
import com.google.common.collect.Sets;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a finished inventory and totals it per resource type. Nested entities, like the volumes of an instance,
 * are counted under their own type.
 */
@Component
public class SummaryReducer {
    private static final Set<ResourceType> CAPACITY_TYPES = Sets.immutableEnumSet(
            ResourceType.S3Bucket, ResourceType.DynamoDBTable, ResourceType.EC2Instance, ResourceType.EBSVolume,
            ResourceType.RDSInstance, ResourceType.RDSCluster, ResourceType.EFSFileSystem,
            ResourceType.FSxFileSystem, ResourceType.RedshiftCluster);

    public InventorySummary reduce(AccountInventory inventory) {
        Map<ResourceType, ResourceTypeSummary> types = new EnumMap<>(ResourceType.class);
        Counters counters = new Counters();
        addAll(types, inventory.getGlobalResources());
        counters.addCollectors(inventory.getScanStatus());
        if (inventory.getRegions() != null) {
            for (RegionReport region : inventory.getRegions().values()) {
                counters.regions++;
                if (region.getScanStatus() != null && region.getScanStatus().getStatus() == ScanStatus.FAILED) {
                    counters.failedRegions++;
                }
                counters.addCollectors(region.getScanStatus());
                addAll(types, region.getRegionWide());
                if (region.getVpcs() == null) {
                    continue;
                }
                for (VpcReport vpc : region.getVpcs().values()) {
                    counters.vpcs++;
                    counters.addCollectors(vpc.getScanStatus());
                    addAll(types, vpc.getNetworkComponents());
                    add(types, vpc.getSecurityGroups());
                    addAll(types, vpc.getResources());
                }
            }
        }
        return InventorySummary.builder()
                .types(types)
                .regionCount(counters.regions)
                .failedRegionCount(counters.failedRegions)
                .vpcCount(counters.vpcs)
                .partialCollectorCount(counters.partialCollectors)
                .failedCollectorCount(counters.failedCollectors)
                .build();
    }

    private void addAll(Map<ResourceType, ResourceTypeSummary> types,
                        Map<String, List<ResourceEntity>> entitiesByToken) {
        if (entitiesByToken != null) {
            entitiesByToken.values().forEach(entities -> add(types, entities));
        }
    }

    private void add(Map<ResourceType, ResourceTypeSummary> types, Collection<? extends ResourceEntity> entities) {
        if (entities == null) {
            return;
        }
        for (ResourceEntity entity : entities) {
            ResourceType type = entity.getResourceType();
            types.computeIfAbsent(type, k -> new ResourceTypeSummary()).add(entity, CAPACITY_TYPES.contains(type));
            add(types, entity.nestedEntities());
        }
    }

    private static class Counters {
        private int regions;
        private int failedRegions;
        private int vpcs;
        private int partialCollectors;
        private int failedCollectors;

        private void addCollectors(ScopeStatus scopeStatus) {
            if (scopeStatus == null || scopeStatus.getCollectors() == null) {
                return;
            }
            for (CollectorStatus status : scopeStatus.getCollectors().values()) {
                if (status.getStatus() == ScanStatus.FAILED) {
                    failedCollectors++;
                } else if (status.getStatus() != ScanStatus.COMPLETE) {
                    partialCollectors++;
                }
            }
        }
    }
}
