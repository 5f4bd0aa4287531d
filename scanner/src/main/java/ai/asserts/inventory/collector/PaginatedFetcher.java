/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import ai.asserts.inventory.AWSApiCallRateLimiter;
import ai.asserts.inventory.ScanCancellation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.AbortedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Walks the pages of a listing call. Every page request goes through the {@link AWSApiCallRateLimiter}. There are no
 * retries here, the SDK retry policy applies to each page request.
 */
@Component
@Slf4j
public class PaginatedFetcher {
    private final AWSApiCallRateLimiter rateLimiter;
    private final ScanCancellation scanCancellation;

    public PaginatedFetcher(AWSApiCallRateLimiter rateLimiter, ScanCancellation scanCancellation) {
        this.rateLimiter = rateLimiter;
        this.scanCancellation = scanCancellation;
    }

    /**
     * Lazily iterates over the records of all pages. The next page is requested only when the records of the current
     * page have been consumed.
     *
     * @param pageCall  makes the call for the given continuation token, <code>null</code> for the first page
     * @param records   extracts the records from a page
     * @param nextToken extracts the continuation token from a page
     */
    public <R, T> PageIterator<R, T> iterate(ScanScope scope, String api, Function<String, R> pageCall,
                                            Function<R, List<T>> records, Function<R, String> nextToken) {
        return new PageIterator<>(scope, api, pageCall, records, nextToken);
    }

    public <R, T> FetchResult<T> fetchAll(ScanScope scope, String api, Function<String, R> pageCall,
                                          Function<R, List<T>> records, Function<R, String> nextToken) {
        PageIterator<R, T> iterator = iterate(scope, api, pageCall, records, nextToken);
        List<T> all = new ArrayList<>();
        iterator.forEachRemaining(all::add);
        return iterator.toResult(all);
    }

    public class PageIterator<R, T> implements Iterator<T> {
        private final ScanScope scope;
        private final String api;
        private final Function<String, R> pageCall;
        private final Function<R, List<T>> records;
        private final Function<R, String> nextToken;
        private final Paginator paginator = new Paginator();
        private Iterator<T> page = Collections.emptyIterator();
        private boolean exhausted;
        private boolean cancelled;
        private Throwable failure;

        private PageIterator(ScanScope scope, String api, Function<String, R> pageCall,
                             Function<R, List<T>> records, Function<R, String> nextToken) {
            this.scope = scope;
            this.api = api;
            this.pageCall = pageCall;
            this.records = records;
            this.nextToken = nextToken;
        }

        @Override
        public boolean hasNext() {
            while (!page.hasNext() && !exhausted) {
                fetchPage();
            }
            return page.hasNext();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }

        public FetchResult<T> toResult(List<T> fetched) {
            return FetchResult.<T>builder()
                    .records(fetched)
                    .pages(paginator.getPages())
                    .failure(failure)
                    .cancelled(cancelled)
                    .build();
        }

        private void fetchPage() {
            if (!paginator.hasNext()) {
                if (paginator.isRepeatedToken()) {
                    log.warn("{} returned the same continuation token twice in {}, stopping", api, scope);
                }
                exhausted = true;
                return;
            }
            if (scanCancellation.isCancelled()) {
                log.info("Scan cancelled, not fetching page {} of {}", paginator.getPages() + 1, api);
                cancelled = true;
                exhausted = true;
                return;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("{} interrupted before page {} in {}", api, paginator.getPages() + 1, scope);
                failure = new TimeoutException(scope + " timed out");
                exhausted = true;
                return;
            }
            String token = paginator.getNextToken();
            try {
                R response = rateLimiter.doWithRateLimit(api, scope.apiLabels(api), () -> pageCall.apply(token));
                List<T> pageRecords = records.apply(response);
                paginator.nextToken(nextToken.apply(response));
                page = pageRecords != null ? pageRecords.iterator() : Collections.emptyIterator();
            } catch (AbortedException e) {
                // Thrown by the SDK when the calling thread is interrupted
                Thread.currentThread().interrupt();
                log.warn("{} interrupted on page {} in {}", api, paginator.getPages() + 1, scope);
                failure = new TimeoutException(scope + " timed out");
                exhausted = true;
            } catch (RuntimeException e) {
                log.warn("{} failed on page {} in {}", api, paginator.getPages() + 1, scope, e);
                failure = e;
                exhausted = true;
            }
        }
    }
}
