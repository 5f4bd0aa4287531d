/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.error;

import lombok.Getter;

/**
 * A failure that ends the whole scan. Everything below the account level is recorded in the scan status instead.
 */
@Getter
public class InventoryScanException extends RuntimeException {
    private final ScanErrorType errorType;

    public InventoryScanException(ScanErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
