/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.ResourceType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public final class TestScopes {
    public static final String ACCOUNT = "123456789012";
    public static final String REGION = "us-east-1";

    private TestScopes() {
    }

    public static ScanPlan plan(ResourceType... excluded) {
        return plan(true, excluded);
    }

    public static ScanPlan plan(boolean collectCapacityMetrics, ResourceType... excluded) {
        Set<ResourceType> excludedTypes = EnumSet.noneOf(ResourceType.class);
        TreeSet<String> tokens = new TreeSet<>();
        for (ResourceType type : excluded) {
            excludedTypes.add(type);
            tokens.add(type.getToken());
        }
        return ScanPlan.builder()
                .accountId(ACCOUNT)
                .homeRegion(REGION)
                .regions(List.of(REGION))
                .excludedTokens(tokens)
                .excludedTypes(excludedTypes)
                .collectCapacityMetrics(collectCapacityMetrics)
                .build();
    }

    public static ScanScope regionScope(ScanPlan plan) {
        return ScanScope.builder()
                .accountId(ACCOUNT)
                .region(REGION)
                .plan(plan)
                .regionCache(new RegionCache())
                .build();
    }

    public static ScanScope vpcScope(ScanPlan plan, String vpcId) {
        return regionScope(plan).forVpc(vpcId);
    }
}
