/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Everything discovered in one VPC. <code>network_components</code> and <code>resources</code> are always present,
 * the keys within them only for collectors that ran and succeeded. <code>security_groups</code> is absent when the
 * type is excluded or could not be listed.
 */
@Getter
@Builder
@ToString
public class VpcReport {
    private final VpcInfo vpcInfo;
    private final Map<String, List<ResourceEntity>> networkComponents;
    private final List<ResourceEntity> securityGroups;
    private final Map<String, List<ResourceEntity>> resources;
    private final ScopeStatus scanStatus;
}
