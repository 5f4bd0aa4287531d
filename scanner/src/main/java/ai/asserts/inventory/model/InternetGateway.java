/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.SortedMap;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class InternetGateway extends ResourceEntity {
    /**
     * Attached VPC id to attachment state.
     */
    private final SortedMap<String, String> attachments;
    private final SortedMap<String, String> tags;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.InternetGateway;
    }
}
