/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static ai.asserts.inventory.MetricNameUtil.ERROR_TYPE_LABEL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_ACCOUNT_ID_LABEL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_ERROR_COUNT_METRIC;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_LATENCY_METRIC;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_OPERATION_LABEL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_REGION_LABEL;
import static java.lang.String.format;
import static java.util.stream.Collectors.joining;

/**
 * Every AWS API call made by the scan goes through this limiter. Calls are rate limited per account, region and
 * operation, their latency and errors are recorded in the meter registry and the number of calls made by a task is
 * logged when the task completes.
 */
@Slf4j
@SuppressWarnings("UnstableApiUsage")
public class AWSApiCallRateLimiter {
    private final MeterRegistry meterRegistry;
    private final double defaultRateLimit;

    private final ThreadLocal<Map<String, Integer>> apiCallCounts = ThreadLocal.withInitial(TreeMap::new);

    private final Map<String, RateLimiter> rateLimiters = new ConcurrentHashMap<>();

    @VisibleForTesting
    public AWSApiCallRateLimiter(MeterRegistry meterRegistry) {
        this(meterRegistry, 20);
    }

    public AWSApiCallRateLimiter(MeterRegistry meterRegistry, double defaultRateLimit) {
        this.meterRegistry = meterRegistry;
        this.defaultRateLimit = defaultRateLimit;
    }

    public <K extends AWSAPICall<V>, V> V doWithRateLimit(String api, SortedMap<String, String> labels, K k) {
        String accountId = labels.get(SCRAPE_ACCOUNT_ID_LABEL);
        String region = labels.get(SCRAPE_REGION_LABEL);
        String regionKey = accountId + "/" + region;
        String fullKey = regionKey + "/" + api;
        RateLimiter rateLimiter = rateLimiters.computeIfAbsent(fullKey, s -> RateLimiter.create(defaultRateLimit));
        long tick = System.currentTimeMillis();
        try {
            double waitTime = rateLimiter.acquire();
            if (waitTime > 0.5) {
                log.warn("Operation {} throttled for {} seconds", fullKey, waitTime);
            }
            Map<String, Integer> callCounts = apiCallCounts.get();
            String operationName = labels.getOrDefault(SCRAPE_OPERATION_LABEL, api);
            String callCountKey = regionKey + "/" + operationName;
            callCounts.merge(callCountKey, 1, Integer::sum);
            tick = System.currentTimeMillis();
            return k.makeCall();
        } catch (RuntimeException e) {
            log.debug("Exception in: " + fullKey, e);
            SortedMap<String, String> errorLabels = new TreeMap<>(labels);
            errorLabels.put(ERROR_TYPE_LABEL, e.getClass().getSimpleName());
            meterRegistry.counter(SCRAPE_ERROR_COUNT_METRIC, toTags(errorLabels)).increment();
            throw e;
        } finally {
            tick = System.currentTimeMillis() - tick;
            meterRegistry.timer(SCRAPE_LATENCY_METRIC, toTags(labels)).record(tick, TimeUnit.MILLISECONDS);
        }
    }

    public <T> T call(Callable<T> callable) throws Exception {
        try {
            return callable.call();
        } finally {
            logAPICallCountsAndClear();
        }
    }

    public void logAPICallCountsAndClear() {
        Map<String, Integer> callCounts = apiCallCounts.get();
        if (!callCounts.isEmpty()) {
            log.debug("AWS API Call Counts \n\n{}\n",
                    callCounts.entrySet().stream()
                            .map(entry -> format("%s=%s", entry.getKey(), entry.getValue()))
                            .collect(joining("\n")));
        }
        callCounts.clear();
    }

    private Tags toTags(SortedMap<String, String> labels) {
        List<Tag> tags = labels.entrySet().stream()
                .map(entry -> Tag.of(entry.getKey(), entry.getValue() != null ? entry.getValue() : "none"))
                .collect(Collectors.toList());
        return Tags.of(tags);
    }

    public interface AWSAPICall<V> {
        V makeCall();
    }
}
