/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.Subnet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsResponse;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.List;
import java.util.stream.Collectors;

import static ai.asserts.inventory.collector.Ec2Filters.vpcFilter;

@Component
@Slf4j
public class SubnetCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public SubnetCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.Subnet;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(scope.getRegion());
        String api = "Ec2Client/describeSubnets";
        FetchResult<software.amazon.awssdk.services.ec2.model.Subnet> fetch = fetcher.fetchAll(scope, api,
                token -> ec2Client.describeSubnets(DescribeSubnetsRequest.builder()
                        .filters(vpcFilter(scope))
                        .nextToken(token)
                        .build()),
                DescribeSubnetsResponse::subnets, DescribeSubnetsResponse::nextToken);
        List<Subnet> subnets = fetch.getRecords().stream()
                .map(subnet -> Subnet.builder()
                        .id(subnet.subnetId())
                        .region(scope.getRegion())
                        .vpcId(subnet.vpcId())
                        .cidrBlock(subnet.cidrBlock())
                        .availabilityZone(subnet.availabilityZone())
                        .state(subnet.stateAsString())
                        .availableIpAddressCount(subnet.availableIpAddressCount())
                        .mapPublicIpOnLaunch(subnet.mapPublicIpOnLaunch())
                        .tags(TagUtil.toMap(subnet.tags(), Tag::key, Tag::value))
                        .build())
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, subnets);
    }
}
