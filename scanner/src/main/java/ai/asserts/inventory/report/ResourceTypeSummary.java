/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.report;

import ai.asserts.inventory.model.ResourceEntity;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Totals for one resource type. A capacity total only sums the entities that report the field.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ResourceTypeSummary {
    private long count;
    private long sizeBytes;
    private long allocatedStorageGb;
    private long itemCount;
    private long objectCount;
    /**
     * Entities of a type with capacity fields that reported none of them.
     */
    private long missingMetrics;

    void add(ResourceEntity entity, boolean hasCapacity) {
        count++;
        boolean reported = false;
        if (entity.getSizeBytes() != null) {
            sizeBytes += entity.getSizeBytes();
            reported = true;
        }
        if (entity.getAllocatedStorageGb() != null) {
            allocatedStorageGb += entity.getAllocatedStorageGb();
            reported = true;
        }
        if (entity.getItemCount() != null) {
            itemCount += entity.getItemCount();
            reported = true;
        }
        if (entity.getObjectCount() != null) {
            objectCount += entity.getObjectCount();
            reported = true;
        }
        if (hasCapacity && !reported) {
            missingMetrics++;
        }
    }
}
