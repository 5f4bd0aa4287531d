/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.scan;

import ai.asserts.inventory.collector.CollectionResult;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.ResourceEntity;
import ai.asserts.inventory.model.ScanStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Folds collector results into the maps of a report node.
 */
final class ScopeResults {
    private ScopeResults() {
    }

    /**
     * Type token to entities, in the order of the results, for the results that produced entities.
     */
    static Map<String, List<ResourceEntity>> entitiesByToken(Collection<CollectionResult> results) {
        Map<String, List<ResourceEntity>> entities = new LinkedHashMap<>();
        results.stream()
                .filter(CollectionResult::hasEntities)
                .forEach(result -> entities.put(result.getType().getToken(), result.getEntities()));
        return entities;
    }

    static SortedMap<String, CollectorStatus> statusByToken(Collection<CollectionResult> results) {
        SortedMap<String, CollectorStatus> statuses = new TreeMap<>();
        results.forEach(result -> statuses.put(result.getType().getToken(), result.getStatus()));
        return statuses;
    }

    static ScanStatus combine(Collection<CollectorStatus> collectors, Collection<ScanStatus> children) {
        List<ScanStatus> all = new ArrayList<>(children);
        collectors.forEach(status -> all.add(status.getStatus()));
        return ScanStatus.combine(all);
    }
}
