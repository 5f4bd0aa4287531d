/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.scan;

import ai.asserts.inventory.ScopeTask;
import ai.asserts.inventory.TaskExecutorUtil;
import ai.asserts.inventory.TaskThreadPool;
import ai.asserts.inventory.collector.CollectionResult;
import ai.asserts.inventory.collector.CollectorRegistry;
import ai.asserts.inventory.collector.FetchResult;
import ai.asserts.inventory.collector.RegionCache;
import ai.asserts.inventory.collector.ScanPlan;
import ai.asserts.inventory.collector.ScanScope;
import ai.asserts.inventory.collector.VpcFetcher;
import ai.asserts.inventory.error.AwsErrorClassifier;
import ai.asserts.inventory.error.ScanErrorType;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.RegionReport;
import ai.asserts.inventory.model.ReportSection;
import ai.asserts.inventory.model.ScanStatus;
import ai.asserts.inventory.model.ScopeStatus;
import ai.asserts.inventory.model.VpcInfo;
import ai.asserts.inventory.model.VpcReport;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static ai.asserts.inventory.BeanConfiguration.API_POOL;
import static ai.asserts.inventory.BeanConfiguration.VPC_POOL;

/**
 * Scans one region: discovers its VPCs, aggregates every VPC on the VPC pool and collects the region wide resources on
 * the API pool, then folds everything into the region's report.
 */
@Component
@Slf4j
public class RegionOrchestrator {
    public static final String VPC_DISCOVERY = "vpcs";
    private final VpcFetcher vpcFetcher;
    private final VpcAggregator vpcAggregator;
    private final CollectorRegistry collectorRegistry;
    private final TaskExecutorUtil taskExecutorUtil;
    private final TaskThreadPool vpcPool;
    private final TaskThreadPool apiPool;

    public RegionOrchestrator(VpcFetcher vpcFetcher, VpcAggregator vpcAggregator,
                              CollectorRegistry collectorRegistry, TaskExecutorUtil taskExecutorUtil,
                              @Qualifier(VPC_POOL) TaskThreadPool vpcPool,
                              @Qualifier(API_POOL) TaskThreadPool apiPool) {
        this.vpcFetcher = vpcFetcher;
        this.vpcAggregator = vpcAggregator;
        this.collectorRegistry = collectorRegistry;
        this.taskExecutorUtil = taskExecutorUtil;
        this.vpcPool = vpcPool;
        this.apiPool = apiPool;
    }

    public RegionReport scanRegion(ScanPlan plan, String region) {
        log.info("Scanning region {}", region);
        ScanScope regionScope = ScanScope.builder()
                .accountId(plan.getAccountId())
                .region(region)
                .plan(plan)
                .regionCache(new RegionCache())
                .build();

        FetchResult<VpcInfo> vpcFetch = vpcFetcher.fetchVpcs(regionScope);
        CollectorStatus discoveryStatus = CollectionResult.statusOf(vpcFetch, null);
        if (vpcFetch.isFailed()) {
            ScanErrorType errorType = discoveryStatus.getErrorType();
            if (errorType == ScanErrorType.NOT_ENABLED || errorType == ScanErrorType.CANCELLED) {
                log.warn("Region {} is not accessible: {}", region, discoveryStatus.getMessage());
                return failed(region, discoveryStatus);
            }
        }
        if (vpcFetch.getRecords().isEmpty()) {
            log.info("No VPCs found in region {}", region);
        }

        List<CollectorTask> regionWideTasks = collectorRegistry.collectorsFor(plan,
                        ImmutableSet.of(ReportSection.REGION_WIDE)).stream()
                .map(collector -> new CollectorTask(collector, regionScope))
                .collect(Collectors.toList());
        List<VpcTask> vpcTasks = vpcFetch.getRecords().stream()
                .map(vpcInfo -> new VpcTask(regionScope.forVpc(vpcInfo.getVpcId()), vpcInfo))
                .collect(Collectors.toList());

        List<Future<CollectionResult>> regionWideFutures = regionWideTasks.stream()
                .map(task -> taskExecutorUtil.executeScopeTask(apiPool, task))
                .collect(Collectors.toList());
        List<Future<VpcReport>> vpcFutures = vpcTasks.stream()
                .map(task -> taskExecutorUtil.executeScopeTask(vpcPool, task))
                .collect(Collectors.toList());
        List<VpcReport> vpcReports = taskExecutorUtil.awaitAll(vpcTasks, vpcFutures);
        List<CollectionResult> regionWide = taskExecutorUtil.awaitAll(regionWideTasks, regionWideFutures);

        SortedMap<String, VpcReport> vpcs = new TreeMap<>();
        vpcReports.forEach(report -> vpcs.put(report.getVpcInfo().getVpcId(), report));

        SortedMap<String, CollectorStatus> statuses = ScopeResults.statusByToken(regionWide);
        statuses.put(VPC_DISCOVERY, discoveryStatus);
        ScanStatus status = ScopeResults.combine(statuses.values(), vpcReports.stream()
                .map(VpcAggregator::statusOf)
                .collect(Collectors.toList()));
        log.info("Finished region {} with {} VPCs, status {}", region, vpcs.size(), status);
        return RegionReport.builder()
                .region(region)
                .vpcs(vpcs)
                .regionWide(ScopeResults.entitiesByToken(regionWide))
                .scanStatus(ScopeStatus.builder()
                        .status(status)
                        .collectors(statuses)
                        .build())
                .build();
    }

    /**
     * Report of a region that could not be scanned at all. It has no data keys, only the status.
     */
    public RegionReport failed(String region, CollectorStatus cause) {
        return RegionReport.builder()
                .region(region)
                .vpcs(new TreeMap<>())
                .scanStatus(ScopeStatus.builder()
                        .status(cause.getStatus() == ScanStatus.CANCELLED ? ScanStatus.CANCELLED : ScanStatus.FAILED)
                        .errorType(cause.getErrorType())
                        .message(cause.getMessage())
                        .collectors(new TreeMap<>(ImmutableSortedMap.of(VPC_DISCOVERY, cause)))
                        .build())
                .build();
    }

    private class VpcTask extends ScopeTask<VpcReport> {
        private final ScanScope vpcScope;
        private final VpcInfo vpcInfo;

        VpcTask(ScanScope vpcScope, VpcInfo vpcInfo) {
            super(vpcScope.toString());
            this.vpcScope = vpcScope;
            this.vpcInfo = vpcInfo;
        }

        @Override
        public VpcReport call() {
            return vpcAggregator.aggregate(vpcScope, vpcInfo);
        }

        @Override
        public VpcReport onError(Throwable e) {
            CollectorStatus cause = CollectionResult.failedStatus(e);
            return vpcAggregator.failed(vpcInfo, ScopeStatus.builder()
                    .status(cause.getStatus())
                    .errorType(cause.getErrorType())
                    .message(AwsErrorClassifier.describe(e))
                    .collectors(new TreeMap<>())
                    .build());
        }
    }
}
