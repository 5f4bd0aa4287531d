/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@EqualsAndHashCode
@ToString
public class Route {
    private final String destination;
    /**
     * Gateway, NAT gateway, instance, peering connection or interface the traffic is sent to.
     */
    private final String target;
    private final String state;
}
