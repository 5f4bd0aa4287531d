/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.model.ResourceType;

/**
 * Discovers the resources of one type in a scope. Implementations report failures through the returned status rather
 * than by throwing.
 */
public interface ResourceCollector {
    ResourceType getType();

    CollectionResult collect(ScanScope scope);
}
