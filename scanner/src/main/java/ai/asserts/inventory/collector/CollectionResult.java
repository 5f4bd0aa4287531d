/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.error.AwsErrorClassifier;
import ai.asserts.inventory.error.ScanErrorType;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.ResourceEntity;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.ScanStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entities and status of one collector run. <code>entities</code> is <code>null</code> when the collector could not
 * list anything, so that the key is left out of the document.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@Slf4j
public class CollectionResult {
    private final ResourceType type;
    private final List<ResourceEntity> entities;
    private final CollectorStatus status;

    public boolean hasEntities() {
        return entities != null;
    }

    public static CollectionResult failed(ResourceType type, Throwable error) {
        return CollectionResult.builder()
                .type(type)
                .status(failedStatus(error))
                .build();
    }

    public static CollectionResult of(ResourceType type, ScanScope scope, FetchResult<?> fetch,
                                      List<? extends ResourceEntity> entities) {
        return of(type, scope, fetch, entities, null);
    }

    /**
     * Builds the result of a collector from the outcome of its primary listing.
     *
     * @param enrichmentFailure failure of a secondary call that fills in capacity or detail fields, if any
     */
    public static CollectionResult of(ResourceType type, ScanScope scope, FetchResult<?> fetch,
                                      List<? extends ResourceEntity> entities, Throwable enrichmentFailure) {
        return CollectionResult.builder()
                .type(type)
                .entities(fetch.isFailed() ? null : normalize(scope, entities))
                .status(statusOf(fetch, enrichmentFailure))
                .build();
    }

    public static CollectorStatus failedStatus(Throwable error) {
        ScanErrorType errorType = AwsErrorClassifier.classify(error);
        return CollectorStatus.builder()
                .status(errorType == ScanErrorType.CANCELLED ? ScanStatus.CANCELLED : ScanStatus.FAILED)
                .errorType(errorType)
                .message(AwsErrorClassifier.describe(error))
                .build();
    }

    public static CollectorStatus statusOf(FetchResult<?> fetch, Throwable enrichmentFailure) {
        if (fetch.isFailed()) {
            if (fetch.getFailure() == null) {
                return CollectorStatus.builder()
                        .status(ScanStatus.CANCELLED)
                        .errorType(ScanErrorType.CANCELLED)
                        .build();
            }
            return failedStatus(fetch.getFailure());
        }
        CollectorStatus.CollectorStatusBuilder status = CollectorStatus.builder()
                .status(ScanStatus.COMPLETE)
                .metricsUnavailable(enrichmentFailure != null);
        if (fetch.isTruncated()) {
            status.truncated(true)
                    .status(fetch.getFailure() == null ? ScanStatus.CANCELLED : ScanStatus.PARTIAL)
                    .errorType(fetch.getFailure() == null ? ScanErrorType.CANCELLED : ScanErrorType.PARTIAL_PAGINATION)
                    .message(AwsErrorClassifier.describe(fetch.getFailure()));
        } else if (enrichmentFailure != null) {
            status.status(ScanStatus.PARTIAL)
                    .errorType(ScanErrorType.METRICS_UNAVAILABLE)
                    .message(AwsErrorClassifier.describe(enrichmentFailure));
        }
        return status.build();
    }

    /**
     * The same entities, reported as partial because some of them could not be placed or described.
     */
    public CollectionResult degrade(Throwable error) {
        if (status.getStatus() != ScanStatus.COMPLETE) {
            return this;
        }
        return toBuilder()
                .status(CollectorStatus.builder()
                        .status(ScanStatus.PARTIAL)
                        .errorType(AwsErrorClassifier.classify(error))
                        .message(AwsErrorClassifier.describe(error))
                        .metricsUnavailable(status.isMetricsUnavailable())
                        .build())
                .build();
    }

    /**
     * Keeps the first entity for each id and, within a VPC, only entities of the scope's region.
     */
    static List<ResourceEntity> normalize(ScanScope scope, List<? extends ResourceEntity> entities) {
        Map<String, ResourceEntity> byId = new LinkedHashMap<>();
        for (ResourceEntity entity : entities) {
            if (scope.isVpcScope() && !scope.getRegion().equals(entity.getRegion())) {
                log.warn("Dropping {} {} of region {} from {}", entity.getResourceType(), entity.getId(),
                        entity.getRegion(), scope);
                continue;
            }
            byId.putIfAbsent(entity.getId(), entity);
        }
        return new ArrayList<>(byId.values());
    }
}
