/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One permission of a security group flattened to a single peer. A permission that lists several CIDR ranges or
 * groups becomes one rule per peer.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class SecurityGroupRule {
    private final String protocol;
    private final Integer fromPort;
    private final Integer toPort;
    /**
     * CIDR range, prefix list or security group id of the peer.
     */
    private final String peer;
    private final String description;
}
