/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.report;

import ai.asserts.inventory.model.ResourceType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@Builder
@ToString
public class InventorySummary {
    private final Map<ResourceType, ResourceTypeSummary> types;
    private final int regionCount;
    private final int failedRegionCount;
    private final int vpcCount;
    private final int partialCollectorCount;
    private final int failedCollectorCount;

    public ResourceTypeSummary getSummary(ResourceType type) {
        return types.getOrDefault(type, new ResourceTypeSummary());
    }
}
