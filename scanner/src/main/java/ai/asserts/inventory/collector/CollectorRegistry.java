/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.ReportSection;
import ai.asserts.inventory.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class CollectorRegistry {
    private final Map<ResourceType, ResourceCollector> collectors = new EnumMap<>(ResourceType.class);

    public CollectorRegistry(List<ResourceCollector> resourceCollectors) {
        resourceCollectors.forEach(collector -> {
            ResourceCollector existing = collectors.put(collector.getType(), collector);
            if (existing != null) {
                throw new IllegalStateException("Multiple collectors registered for " + collector.getType());
            }
        });
        log.info("Registered collectors for {}", collectors.keySet());
    }

    public Optional<ResourceCollector> getCollector(ResourceType type) {
        return Optional.ofNullable(collectors.get(type));
    }

    /**
     * Collectors of the given sections in resource type order, leaving out the excluded types.
     */
    public List<ResourceCollector> collectorsFor(ScanPlan plan, Collection<ReportSection> sections) {
        List<ResourceCollector> selected = new ArrayList<>();
        collectors.forEach((type, collector) -> {
            if (sections.contains(type.getSection()) && !plan.isExcluded(type)) {
                selected.add(collector);
            }
        });
        return selected;
    }
}
