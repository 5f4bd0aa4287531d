/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scan wide cancellation flag, set by the shutdown hook. Once set, fetchers stop requesting further pages. An
 * interrupted thread does not count as a cancelled scan, a scope is interrupted when its parent stops waiting for it.
 */
@Component
@Slf4j
public class ScanCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Scan cancelled, in-flight collectors will stop after the current page");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
