/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.RedshiftCluster;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.redshift.RedshiftClient;
import software.amazon.awssdk.services.redshift.model.Cluster;
import software.amazon.awssdk.services.redshift.model.DescribeClustersRequest;
import software.amazon.awssdk.services.redshift.model.DescribeClustersResponse;

import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
public class RedshiftClusterCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public RedshiftClusterCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.RedshiftCluster;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        FetchResult<Cluster> fetch = scope.getRegionCache().getRedshiftClusters().get(() -> {
            RedshiftClient redshiftClient = awsClientProvider.getRedshiftClient(scope.getRegion());
            return fetcher.fetchAll(scope, "RedshiftClient/describeClusters",
                    token -> redshiftClient.describeClusters(DescribeClustersRequest.builder()
                            .marker(token)
                            .build()),
                    DescribeClustersResponse::clusters, DescribeClustersResponse::marker);
        });
        List<RedshiftCluster> clusters = fetch.getRecords().stream()
                .filter(cluster -> scope.getVpcId().equals(cluster.vpcId()))
                .map(cluster -> RedshiftCluster.builder()
                        .id(cluster.clusterIdentifier())
                        .region(scope.getRegion())
                        .vpcId(cluster.vpcId())
                        .nodeType(cluster.nodeType())
                        .numberOfNodes(cluster.numberOfNodes())
                        .status(cluster.clusterStatus())
                        .dbName(cluster.dbName())
                        .allocatedStorageGb(cluster.totalStorageCapacityInMegaBytes() != null
                                ? cluster.totalStorageCapacityInMegaBytes() / 1024 : null)
                        .build())
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, clusters);
    }
}
