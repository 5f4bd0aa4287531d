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

import java.util.SortedMap;

/**
 * The <code>scan_status</code> block of an account, region or VPC. <code>collectors</code> names every collector
 * run directly in this scope. Child scopes carry their own block.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class ScopeStatus {
    private final ScanStatus status;
    private final ScanErrorType errorType;
    private final String message;
    private final SortedMap<String, CollectorStatus> collectors;
}
