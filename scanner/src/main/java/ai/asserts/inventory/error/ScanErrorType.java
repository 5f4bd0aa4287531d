/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.error;

public enum ScanErrorType {
    ACCESS_DENIED,
    NOT_ENABLED,
    THROTTLED,
    PARTIAL_PAGINATION,
    METRICS_UNAVAILABLE,
    TIMEOUT,
    CANCELLED,
    CREDENTIALS,
    UNKNOWN
}
