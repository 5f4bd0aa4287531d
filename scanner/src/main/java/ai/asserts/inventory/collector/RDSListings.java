/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DBSubnetGroup;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbSubnetGroupsRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbSubnetGroupsResponse;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * RDS listings have no VPC filter. They are fetched once per region and filtered by each VPC.
 */
@Component
public class RDSListings {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public RDSListings(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    public FetchResult<DBInstance> dbInstances(ScanScope scope) {
        return scope.getRegionCache().getDbInstances().get(() -> {
            RdsClient rdsClient = awsClientProvider.getRDSClient(scope.getRegion());
            return fetcher.fetchAll(scope, "RdsClient/describeDBInstances",
                    token -> rdsClient.describeDBInstances(DescribeDbInstancesRequest.builder()
                            .marker(token)
                            .build()),
                    DescribeDbInstancesResponse::dbInstances, DescribeDbInstancesResponse::marker);
        });
    }

    public FetchResult<DBCluster> dbClusters(ScanScope scope) {
        return scope.getRegionCache().getDbClusters().get(() -> {
            RdsClient rdsClient = awsClientProvider.getRDSClient(scope.getRegion());
            return fetcher.fetchAll(scope, "RdsClient/describeDBClusters",
                    token -> rdsClient.describeDBClusters(DescribeDbClustersRequest.builder()
                            .marker(token)
                            .build()),
                    DescribeDbClustersResponse::dbClusters, DescribeDbClustersResponse::marker);
        });
    }

    /**
     * Maps DB subnet group names to VPC ids. A failed lookup is reported through {@link SubnetGroups#getFailure()}.
     */
    public SubnetGroups subnetGroups(ScanScope scope) {
        return scope.getRegionCache().getDbSubnetGroups().get(() -> {
            RdsClient rdsClient = awsClientProvider.getRDSClient(scope.getRegion());
            FetchResult<DBSubnetGroup> fetch = fetcher.fetchAll(scope, "RdsClient/describeDBSubnetGroups",
                    token -> rdsClient.describeDBSubnetGroups(DescribeDbSubnetGroupsRequest.builder()
                            .marker(token)
                            .build()),
                    DescribeDbSubnetGroupsResponse::dbSubnetGroups, DescribeDbSubnetGroupsResponse::marker);
            Map<String, String> groupVpcs = new HashMap<>();
            fetch.getRecords().forEach(group -> groupVpcs.put(group.dbSubnetGroupName(), group.vpcId()));
            Throwable failure = fetch.isCancelled() && fetch.getFailure() == null
                    ? new CancellationException("Scan cancelled") : fetch.getFailure();
            return new SubnetGroups(groupVpcs, failure);
        });
    }

    @Getter
    @AllArgsConstructor
    public static class SubnetGroups {
        private final Map<String, String> groupVpcs;
        private final Throwable failure;

        public String vpcOf(String subnetGroupName) {
            return subnetGroupName != null ? groupVpcs.get(subnetGroupName) : null;
        }
    }
}
