/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

/**
 * Where the entities of a resource type are placed in the inventory document.
 */
public enum ReportSection {
    GLOBAL_RESOURCES,
    REGION_WIDE,
    NETWORK_COMPONENTS,
    SECURITY_GROUPS,
    VPC_RESOURCES,
    // Nested inside another entity, no collector of its own
    INSTANCE_VOLUMES;

    public boolean isVpcScoped() {
        return this == NETWORK_COMPONENTS || this == SECURITY_GROUPS || this == VPC_RESOURCES;
    }
}
