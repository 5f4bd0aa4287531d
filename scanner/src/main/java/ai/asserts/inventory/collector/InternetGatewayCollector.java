/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.InternetGateway;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInternetGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInternetGatewaysResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.InternetGatewayAttachment;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Internet gateways are not owned by a VPC, they are found through their attachment.
 */
@Component
@Slf4j
public class InternetGatewayCollector implements ResourceCollector {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public InternetGatewayCollector(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    @Override
    public ResourceType getType() {
        return ResourceType.InternetGateway;
    }

    @Override
    public CollectionResult collect(ScanScope scope) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(scope.getRegion());
        String api = "Ec2Client/describeInternetGateways";
        Filter attachmentFilter = Filter.builder()
                .name("attachment.vpc-id")
                .values(scope.getVpcId())
                .build();
        FetchResult<software.amazon.awssdk.services.ec2.model.InternetGateway> fetch = fetcher.fetchAll(scope, api,
                token -> ec2Client.describeInternetGateways(DescribeInternetGatewaysRequest.builder()
                        .filters(attachmentFilter)
                        .nextToken(token)
                        .build()),
                DescribeInternetGatewaysResponse::internetGateways, DescribeInternetGatewaysResponse::nextToken);
        List<InternetGateway> gateways = fetch.getRecords().stream()
                .map(gateway -> InternetGateway.builder()
                        .id(gateway.internetGatewayId())
                        .region(scope.getRegion())
                        .attachments(TagUtil.toMap(gateway.attachments(), InternetGatewayAttachment::vpcId,
                                InternetGatewayAttachment::stateAsString))
                        .tags(TagUtil.toMap(gateway.tags(), Tag::key, Tag::value))
                        .build())
                .collect(Collectors.toList());
        return CollectionResult.of(getType(), scope, fetch, gateways);
    }
}
