/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TaskThreadPoolTest extends EasyMockSupport {
    @Test
    public void constructor() {
        MeterRegistry mockMeterRegistry = mock(MeterRegistry.class);
        ExecutorService mockService = mock(ExecutorService.class);
        replayAll();
        TaskThreadPool pool = new TaskThreadPool("test pool", 1, mockMeterRegistry) {
            @Override
            ExecutorService buildExecutorService(String name, int nThreads, MeterRegistry meterRegistry) {
                assertEquals("test pool", name);
                assertEquals(1, nThreads);
                return mockService;
            }
        };
        assertSame(mockService, pool.getExecutorService());
        verifyAll();
    }

    @Test
    public void shutdown() throws Exception {
        TaskThreadPool pool = new TaskThreadPool("region-scan-thread-pool", 2, new SimpleMeterRegistry());
        assertEquals("done", pool.getExecutorService().submit(() -> "done").get(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertTrue(pool.getExecutorService().awaitTermination(5, TimeUnit.SECONDS));
    }
}
