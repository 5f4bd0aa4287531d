/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Records of a paginated listing together with how the walk over the pages ended.
 */
@Getter
@Builder
@ToString
public class FetchResult<T> {
    private final List<T> records;
    private final int pages;
    private final Throwable failure;
    private final boolean cancelled;

    /**
     * Nothing could be fetched, not even the first page.
     */
    public boolean isFailed() {
        return isInterrupted() && pages == 0;
    }

    /**
     * Some pages were fetched before the walk stopped on a failure or cancellation.
     */
    public boolean isTruncated() {
        return isInterrupted() && pages > 0;
    }

    private boolean isInterrupted() {
        return failure != null || cancelled;
    }
}
