/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.NatGateway;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeNatGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeNatGatewaysResponse;
import software.amazon.awssdk.services.ec2.model.NatGatewayAddress;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static ai.asserts.inventory.collector.Ec2Filters.vpcFilter;

@Component
@Slf4j
public class NatGatewayCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public NatGatewayCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.NatGateway;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(scope.getRegion());
        String api = "Ec2Client/describeNatGateways";
        FetchResult<software.amazon.awssdk.services.ec2.model.NatGateway> fetch = fetcher.fetchAll(scope, api,
                token -> ec2Client.describeNatGateways(DescribeNatGatewaysRequest.builder()
                        .filter(vpcFilter(scope))
                        .nextToken(token)
                        .build()),
                DescribeNatGatewaysResponse::natGateways, DescribeNatGatewaysResponse::nextToken);
        List<NatGateway> gateways = fetch.getRecords().stream()
                .map(gateway -> NatGateway.builder()
                        .id(gateway.natGatewayId())
                        .region(scope.getRegion())
                        .vpcId(gateway.vpcId())
                        .subnetId(gateway.subnetId())
                        .state(gateway.stateAsString())
                        .connectivityType(gateway.connectivityTypeAsString())
                        .publicIps(gateway.natGatewayAddresses().stream()
                                .map(NatGatewayAddress::publicIp)
                                .filter(Objects::nonNull)
                                .collect(Collectors.toList()))
                        .privateIps(gateway.natGatewayAddresses().stream()
                                .map(NatGatewayAddress::privateIp)
                                .filter(Objects::nonNull)
                                .collect(Collectors.toList()))
                        .tags(TagUtil.toMap(gateway.tags(), Tag::key, Tag::value))
                        .build())
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, gateways);
    }
}
