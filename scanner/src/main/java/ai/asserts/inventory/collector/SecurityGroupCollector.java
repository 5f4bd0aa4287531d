/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.SecurityGroup;
import ai.asserts.inventory.model.SecurityGroupRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeSecurityGroupsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSecurityGroupsResponse;
import software.amazon.awssdk.services.ec2.model.IpPermission;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static ai.asserts.inventory.collector.Ec2Filters.vpcFilter;

@Component
@Slf4j
public class SecurityGroupCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public SecurityGroupCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.SecurityGroup;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(scope.getRegion());
        String api = "Ec2Client/describeSecurityGroups";
        FetchResult<software.amazon.awssdk.services.ec2.model.SecurityGroup> fetch = fetcher.fetchAll(scope, api,
                token -> ec2Client.describeSecurityGroups(DescribeSecurityGroupsRequest.builder()
                        .filters(vpcFilter(scope))
                        .nextToken(token)
                        .build()),
                DescribeSecurityGroupsResponse::securityGroups, DescribeSecurityGroupsResponse::nextToken);
        List<SecurityGroup> securityGroups = fetch.getRecords().stream()
                .map(group -> SecurityGroup.builder()
                        .id(group.groupId())
                        .region(scope.getRegion())
                        .vpcId(group.vpcId())
                        .groupName(group.groupName())
                        .description(group.description())
                        .ingressRules(toRules(group.ipPermissions()))
                        .egressRules(toRules(group.ipPermissionsEgress()))
                        .tags(TagUtil.toMap(group.tags(), Tag::key, Tag::value))
                        .build())
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, securityGroups);
    }

    List<SecurityGroupRule> toRules(List<IpPermission> permissions) {
        List<SecurityGroupRule> rules = new ArrayList<>();
        for (IpPermission permission : permissions) {
            String protocol = "-1".equals(permission.ipProtocol()) ? "all" : permission.ipProtocol();
            permission.ipRanges().forEach(range -> rules.add(
                    rule(permission, protocol, range.cidrIp(), range.description())));
            permission.ipv6Ranges().forEach(range -> rules.add(
                    rule(permission, protocol, range.cidrIpv6(), range.description())));
            permission.prefixListIds().forEach(prefixList -> rules.add(
                    rule(permission, protocol, prefixList.prefixListId(), prefixList.description())));
            permission.userIdGroupPairs().forEach(pair -> rules.add(
                    rule(permission, protocol, pair.groupId(), pair.description())));
        }
        return rules;
    }

    private SecurityGroupRule rule(IpPermission permission, String protocol, String peer, String description) {
        return SecurityGroupRule.builder()
                .protocol(protocol)
                .fromPort(permission.fromPort())
                .toPort(permission.toPort())
                .peer(peer)
                .description(description)
                .build();
    }
}
