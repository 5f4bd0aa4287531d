/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.fsx.model.FileSystem;
import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.redshift.model.Cluster;

import java.util.function.Supplier;

/**
 * Listings that can only be filtered by VPC on the client side are fetched once per region and shared by the VPCs of
 * the region.
 */
@Getter
public class RegionCache {
    private final Listing<FetchResult<DBInstance>> dbInstances = new Listing<>("rds/db-instances");
    private final Listing<FetchResult<DBCluster>> dbClusters = new Listing<>("rds/db-clusters");
    private final Listing<RDSListings.SubnetGroups> dbSubnetGroups = new Listing<>("rds/db-subnet-groups");
    private final Listing<EFSListings.Placements> efsPlacements = new Listing<>("efs/placements");
    private final Listing<FetchResult<Cluster>> redshiftClusters = new Listing<>("redshift/clusters");
    private final Listing<FetchResult<FileSystem>> fsxFileSystems = new Listing<>("fsx/file-systems");

    /**
     * A value computed by the first caller, concurrent callers wait for it. A value loaded on a thread that was
     * interrupted while loading is handed to that caller only, the next caller loads again.
     */
    @Slf4j
    public static class Listing<T> {
        private final String name;
        private T value;

        Listing(String name) {
            this.name = name;
        }

        public synchronized T get(Supplier<T> loader) {
            if (value != null) {
                return value;
            }
            T loaded = loader.get();
            if (Thread.currentThread().isInterrupted()) {
                log.info("Not caching {}, the loading thread was interrupted", name);
            } else {
                value = loaded;
            }
            return loaded;
        }
    }
}
