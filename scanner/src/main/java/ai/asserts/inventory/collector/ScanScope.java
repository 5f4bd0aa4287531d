/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import com.google.common.collect.ImmutableSortedMap;
import lombok.Builder;
import lombok.Getter;

import java.util.SortedMap;

import static ai.asserts.inventory.MetricNameUtil.SCRAPE_ACCOUNT_ID_LABEL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_OPERATION_LABEL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_REGION_LABEL;

/**
 * Where a collector runs: the account and region, and for VPC scoped collectors the VPC.
 */
@Getter
@Builder(toBuilder = true)
public class ScanScope {
    private final String accountId;
    private final String region;
    private final String vpcId;
    private final ScanPlan plan;
    private final RegionCache regionCache;

    public ScanScope forVpc(String vpcId) {
        return toBuilder().vpcId(vpcId).build();
    }

    public boolean isVpcScope() {
        return vpcId != null;
    }

    public SortedMap<String, String> apiLabels(String api) {
        return ImmutableSortedMap.of(
                SCRAPE_ACCOUNT_ID_LABEL, accountId,
                SCRAPE_REGION_LABEL, region,
                SCRAPE_OPERATION_LABEL, api);
    }

    @Override
    public String toString() {
        return vpcId != null ? region + "/" + vpcId : region;
    }
}
