/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * One region of the inventory. The VPC reports are written as keys directly under the region, next to
 * <code>region_wide</code> and <code>scan_status</code>. A region that could not be scanned at all has neither VPCs
 * nor <code>region_wide</code>.
 */
@Getter
@Builder
@ToString
public class RegionReport {
    @JsonIgnore
    private final String region;
    @JsonIgnore
    private final SortedMap<String, VpcReport> vpcs;
    private final Map<String, List<ResourceEntity>> regionWide;
    private final ScopeStatus scanStatus;

    @JsonAnyGetter
    public Map<String, VpcReport> vpcReports() {
        return vpcs;
    }
}
