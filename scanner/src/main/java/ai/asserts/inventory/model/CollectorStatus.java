/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import ai.asserts.inventory.error.ScanErrorType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one collector in one scope.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class CollectorStatus {
    private final ScanStatus status;
    private final ScanErrorType errorType;
    private final String message;
    private final boolean truncated;
    private final boolean metricsUnavailable;

    public static CollectorStatus complete() {
        return CollectorStatus.builder().status(ScanStatus.COMPLETE).build();
    }
}
