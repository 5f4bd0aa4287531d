/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.scan;

import ai.asserts.inventory.AWSApiCallRateLimiter;
import ai.asserts.inventory.AWSClientProvider;
import ai.asserts.inventory.AccountIDProvider;
import ai.asserts.inventory.ScanCancellation;
import ai.asserts.inventory.ScopeTask;
import ai.asserts.inventory.TaskExecutorUtil;
import ai.asserts.inventory.TaskThreadPool;
import ai.asserts.inventory.collector.CollectionResult;
import ai.asserts.inventory.collector.CollectorRegistry;
import ai.asserts.inventory.collector.RegionCache;
import ai.asserts.inventory.collector.ScanPlan;
import ai.asserts.inventory.collector.ScanScope;
import ai.asserts.inventory.config.ScanConfig;
import ai.asserts.inventory.model.AccountInventory;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.RegionReport;
import ai.asserts.inventory.model.ReportSection;
import ai.asserts.inventory.model.ScanMetadata;
import ai.asserts.inventory.model.ScanStatus;
import ai.asserts.inventory.model.ScopeStatus;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsResponse;
import software.amazon.awssdk.services.ec2.model.Region;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static ai.asserts.inventory.BeanConfiguration.API_POOL;
import static ai.asserts.inventory.BeanConfiguration.REGION_POOL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_ACCOUNT_ID_LABEL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_OPERATION_LABEL;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_REGION_LABEL;

/**
 * Scans the whole account. Credentials are verified first, then the regions and the exclusions are resolved into a
 * {@link ScanPlan} shared by all scopes. Global collectors and regions run concurrently and are merged into the
 * account inventory.
 */
@Component
@Slf4j
public class AccountOrchestrator {
    public static final String REGION_DISCOVERY = "regions";
    private final AccountIDProvider accountIDProvider;
    private final AWSClientProvider awsClientProvider;
    private final AWSApiCallRateLimiter rateLimiter;
    private final RegionOrchestrator regionOrchestrator;
    private final CollectorRegistry collectorRegistry;
    private final TaskExecutorUtil taskExecutorUtil;
    private final ScanCancellation scanCancellation;
    private final TaskThreadPool regionPool;
    private final TaskThreadPool apiPool;

    public AccountOrchestrator(AccountIDProvider accountIDProvider, AWSClientProvider awsClientProvider,
                               AWSApiCallRateLimiter rateLimiter, RegionOrchestrator regionOrchestrator,
                               CollectorRegistry collectorRegistry, TaskExecutorUtil taskExecutorUtil,
                               ScanCancellation scanCancellation,
                               @Qualifier(REGION_POOL) TaskThreadPool regionPool,
                               @Qualifier(API_POOL) TaskThreadPool apiPool) {
        this.accountIDProvider = accountIDProvider;
        this.awsClientProvider = awsClientProvider;
        this.rateLimiter = rateLimiter;
        this.regionOrchestrator = regionOrchestrator;
        this.collectorRegistry = collectorRegistry;
        this.taskExecutorUtil = taskExecutorUtil;
        this.scanCancellation = scanCancellation;
        this.regionPool = regionPool;
        this.apiPool = apiPool;
    }

    public AccountInventory scan(ScanConfig scanConfig) {
        Instant scanStarted = Instant.now();
        String accountId = accountIDProvider.getAccountId(scanConfig.getHomeRegion());

        SortedMap<String, CollectorStatus> statuses = new TreeMap<>();
        List<String> regions = new ArrayList<>(scanConfig.getRegions());
        if (regions.isEmpty()) {
            try {
                regions = discoverRegions(accountId, scanConfig.getHomeRegion());
                statuses.put(REGION_DISCOVERY, CollectorStatus.complete());
            } catch (RuntimeException e) {
                log.error("Could not list the enabled regions, scanning only {}", scanConfig.getHomeRegion(), e);
                regions = List.of(scanConfig.getHomeRegion());
                statuses.put(REGION_DISCOVERY, CollectionResult.failedStatus(e));
            }
        }

        ScanPlan plan = ScanPlan.builder()
                .accountId(accountId)
                .homeRegion(scanConfig.getHomeRegion())
                .regions(regions)
                .excludedTokens(new TreeSet<>(scanConfig.getExclude()))
                .excludedTypes(scanConfig.getExcludedTypes())
                .collectCapacityMetrics(scanConfig.isCollectCapacityMetrics())
                .build();
        log.info("Scanning account {} in regions {}, excluding {}", accountId, regions, plan.getExcludedTypes());

        ScanScope globalScope = ScanScope.builder()
                .accountId(accountId)
                .region(scanConfig.getHomeRegion())
                .plan(plan)
                .regionCache(new RegionCache())
                .build();
        List<CollectorTask> globalTasks = collectorRegistry.collectorsFor(plan,
                        ImmutableSet.of(ReportSection.GLOBAL_RESOURCES)).stream()
                .map(collector -> new CollectorTask(collector, globalScope))
                .collect(Collectors.toList());
        List<RegionTask> regionTasks = regions.stream()
                .map(region -> new RegionTask(plan, region))
                .collect(Collectors.toList());

        List<Future<CollectionResult>> globalFutures = globalTasks.stream()
                .map(task -> taskExecutorUtil.executeScopeTask(apiPool, task))
                .collect(Collectors.toList());
        List<Future<RegionReport>> regionFutures = regionTasks.stream()
                .map(task -> taskExecutorUtil.executeScopeTask(regionPool, task))
                .collect(Collectors.toList());
        List<RegionReport> regionReports = taskExecutorUtil.awaitAll(regionTasks, regionFutures);
        List<CollectionResult> global = taskExecutorUtil.awaitAll(globalTasks, globalFutures);

        SortedMap<String, RegionReport> regionsByName = new TreeMap<>();
        regionReports.forEach(report -> regionsByName.put(report.getRegion(), report));
        statuses.putAll(ScopeResults.statusByToken(global));

        boolean cancelled = scanCancellation.isCancelled();
        ScanStatus status = cancelled ? ScanStatus.CANCELLED : ScopeResults.combine(statuses.values(),
                regionReports.stream()
                        .map(report -> report.getScanStatus().getStatus())
                        .collect(Collectors.toList()));
        log.info("Finished scanning account {}, status {}", accountId, status);
        return AccountInventory.builder()
                .globalResources(ScopeResults.entitiesByToken(global))
                .regions(regionsByName)
                .scanStatus(ScopeStatus.builder()
                        .status(status)
                        .collectors(statuses)
                        .build())
                .scanMetadata(ScanMetadata.builder()
                        .accountId(accountId)
                        .scanStarted(scanStarted)
                        .scanFinished(Instant.now())
                        .regions(regions)
                        .excluded(plan.getExcludedTokens())
                        .complete(!cancelled)
                        .cancelled(cancelled)
                        .build())
                .build();
    }

    private List<String> discoverRegions(String accountId, String homeRegion) {
        Ec2Client ec2Client = awsClientProvider.getEc2Client(homeRegion);
        String api = "Ec2Client/describeRegions";
        DescribeRegionsResponse response = rateLimiter.doWithRateLimit(api, ImmutableSortedMap.of(
                        SCRAPE_ACCOUNT_ID_LABEL, accountId,
                        SCRAPE_REGION_LABEL, homeRegion,
                        SCRAPE_OPERATION_LABEL, api),
                () -> ec2Client.describeRegions(DescribeRegionsRequest.builder()
                        .allRegions(false)
                        .build()));
        return response.regions().stream()
                .map(Region::regionName)
                .sorted()
                .collect(Collectors.toList());
    }

    private class RegionTask extends ScopeTask<RegionReport> {
        private final ScanPlan plan;
        private final String region;

        RegionTask(ScanPlan plan, String region) {
            super(region);
            this.plan = plan;
            this.region = region;
        }

        @Override
        public RegionReport call() {
            return regionOrchestrator.scanRegion(plan, region);
        }

        @Override
        public RegionReport onError(Throwable e) {
            return regionOrchestrator.failed(region, CollectionResult.failedStatus(e));
        }
    }
}
