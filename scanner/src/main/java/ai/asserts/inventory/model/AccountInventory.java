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
 * Root of the inventory document. Region reports are written as keys directly under the root.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class AccountInventory {
    private final Map<String, List<ResourceEntity>> globalResources;
    @JsonIgnore
    private final SortedMap<String, RegionReport> regions;
    private final ScopeStatus scanStatus;
    private final ScanMetadata scanMetadata;

    @JsonAnyGetter
    public Map<String, RegionReport> regionReports() {
        return regions;
    }
}
