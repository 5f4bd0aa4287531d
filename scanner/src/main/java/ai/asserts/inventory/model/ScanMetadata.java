/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

@Getter
@Builder
@ToString
public class ScanMetadata {
    private final String accountId;
    private final Instant scanStarted;
    private final Instant scanFinished;
    private final List<String> regions;
    private final SortedSet<String> excluded;
    private final boolean complete;
    private final boolean cancelled;
}
