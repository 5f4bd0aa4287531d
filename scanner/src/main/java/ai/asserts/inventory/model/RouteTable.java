/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;
import java.util.SortedMap;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RouteTable extends ResourceEntity {
    private final String vpcId;
    private final boolean main;
    private final List<String> associatedSubnets;
    private final List<Route> routes;
    private final SortedMap<String, String> tags;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.RouteTable;
    }
}
