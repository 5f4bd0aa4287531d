/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.model.VpcInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsResponse;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.Vpc;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists the VPCs of a region.
 */
@Component
@Slf4j
public class VpcFetcher {
    private final AWSClientProvider awsClientProvider;
    private final PaginatedFetcher fetcher;

    public VpcFetcher(AWSClientProvider awsClientProvider, PaginatedFetcher fetcher) {
        this.awsClientProvider = awsClientProvider;
        this.fetcher = fetcher;
    }

    public FetchResult<VpcInfo> fetchVpcs(ScanScope scope) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(scope.getRegion());
        String api = "Ec2Client/describeVpcs";
        FetchResult<Vpc> fetch = fetcher.fetchAll(scope, api,
                token -> ec2Client.describeVpcs(DescribeVpcsRequest.builder()
                        .nextToken(token)
                        .build()),
                DescribeVpcsResponse::vpcs, DescribeVpcsResponse::nextToken);
        List<VpcInfo> vpcs = fetch.getRecords().stream()
                .map(vpc -> VpcInfo.builder()
                        .vpcId(vpc.vpcId())
                        .cidrBlock(vpc.cidrBlock())
                        .state(vpc.stateAsString())
                        .defaultVpc(vpc.isDefault())
                        .tags(TagUtil.toMap(vpc.tags(), Tag::key, Tag::value))
                        .build())
                .collect(Collectors.toList());
        log.debug("Found {} VPCs in {}", vpcs.size(), scope);
        return FetchResult.<VpcInfo>builder()
                .records(vpcs)
                .pages(fetch.getPages())
                .failure(fetch.getFailure())
                .cancelled(fetch.isCancelled())
                .build();
    }
}
