/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.ResourceType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * What a scan covers, resolved once at the start of the scan and shared by every scope.
 */
@Getter
@Builder
@ToString
public class ScanPlan {
    private final String accountId;
    private final String homeRegion;
    private final List<String> regions;
    /**
     * Exclusion tokens as configured.
     */
    private final SortedSet<String> excludedTokens;
    private final Set<ResourceType> excludedTypes;
    private final boolean collectCapacityMetrics;

    public boolean isExcluded(ResourceType type) {
        return excludedTypes.contains(type);
    }
}
