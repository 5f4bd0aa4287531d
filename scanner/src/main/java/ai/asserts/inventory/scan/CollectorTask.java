/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.scan;

import ai.asserts.inventory.ScopeTask;
import ai.asserts.inventory.collector.CollectionResult;
import ai.asserts.inventory.collector.ResourceCollector;
import ai.asserts.inventory.collector.ScanScope;

/**
 * Runs one collector in one scope. Anything thrown by the collector becomes a failed result for its type.
 */
public class CollectorTask extends ScopeTask<CollectionResult> {
    private final ResourceCollector collector;
    private final ScanScope scanScope;

    public CollectorTask(ResourceCollector collector, ScanScope scanScope) {
        super(scanScope + "/" + collector.getType().getToken());
        this.collector = collector;
        this.scanScope = scanScope;
    }

    @Override
    public CollectionResult call() {
        return collector.collect(scanScope);
    }

    @Override
    public CollectionResult onError(Throwable e) {
        return CollectionResult.failed(collector.getType(), e);
    }
}
