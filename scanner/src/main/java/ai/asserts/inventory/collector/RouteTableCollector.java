/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.Route;
import ai.asserts.inventory.model.RouteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeRouteTablesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeRouteTablesResponse;
import software.amazon.awssdk.services.ec2.model.RouteTableAssociation;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static ai.asserts.inventory.collector.Ec2Filters.vpcFilter;

@Component
@Slf4j
public class RouteTableCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public RouteTableCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.RouteTable;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(scope.getRegion());
        String api = "Ec2Client/describeRouteTables";
        FetchResult<software.amazon.awssdk.services.ec2.model.RouteTable> fetch = fetcher.fetchAll(scope, api,
                token -> ec2Client.describeRouteTables(DescribeRouteTablesRequest.builder()
                        .filters(vpcFilter(scope))
                        .nextToken(token)
                        .build()),
                DescribeRouteTablesResponse::routeTables, DescribeRouteTablesResponse::nextToken);
        List<RouteTable> routeTables = fetch.getRecords().stream()
                .map(routeTable -> RouteTable.builder()
                        .id(routeTable.routeTableId())
                        .region(scope.getRegion())
                        .vpcId(routeTable.vpcId())
                        .main(routeTable.associations().stream()
                                .anyMatch(association -> Boolean.TRUE.equals(association.main())))
                        .associatedSubnets(routeTable.associations().stream()
                                .map(RouteTableAssociation::subnetId)
                                .filter(Objects::nonNull)
                                .collect(Collectors.toList()))
                        .routes(routeTable.routes().stream()
                                .map(this::toRoute)
                                .collect(Collectors.toList()))
                        .tags(TagUtil.toMap(routeTable.tags(), Tag::key, Tag::value))
                        .build())
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, routeTables);
    }

    private Route toRoute(software.amazon.awssdk.services.ec2.model.Route route) {
        String destination = firstPresent(route.destinationCidrBlock(), route.destinationIpv6CidrBlock(),
                route.destinationPrefixListId());
        String target = firstPresent(route.gatewayId(), route.natGatewayId(), route.transitGatewayId(),
                route.vpcPeeringConnectionId(), route.instanceId(), route.networkInterfaceId(),
                route.egressOnlyInternetGatewayId(), route.localGatewayId(), route.carrierGatewayId());
        return Route.builder()
                .destination(destination)
                .target(target)
                .state(route.stateAsString())
                .build();
    }

    private static String firstPresent(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
