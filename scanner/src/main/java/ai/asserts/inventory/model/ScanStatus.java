/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import java.util.Collection;

public enum ScanStatus {
    COMPLETE,
    PARTIAL,
    FAILED,
    CANCELLED;

    /**
     * Status of a scope given the status of everything it ran. Cancellation dominates, then any incomplete child
     * makes the scope partial.
     */
    public static ScanStatus combine(Collection<ScanStatus> children) {
        if (children.contains(CANCELLED)) {
            return CANCELLED;
        }
        boolean allComplete = children.stream().allMatch(status -> status == COMPLETE);
        return allComplete ? COMPLETE : PARTIAL;
    }
}
