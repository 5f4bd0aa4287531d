/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Collections;
import java.util.List;

/**
 * Base of every discovered resource. The capacity fields are optional and left out of the document when the
 * resource does not report them or the metric could not be fetched.
 */
@Getter
@SuperBuilder
@EqualsAndHashCode
@ToString
public abstract class ResourceEntity {
    private final String id;
    private final String region;
    private final Long sizeBytes;
    private final Long allocatedStorageGb;
    private final Long itemCount;
    private final Long objectCount;

    public abstract ResourceType getResourceType();

    /**
     * Entities nested inside this one, like the volumes attached to an instance.
     */
    public List<? extends ResourceEntity> nestedEntities() {
        return Collections.emptyList();
    }
}
