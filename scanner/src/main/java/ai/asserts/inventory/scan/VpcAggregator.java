/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.scan;

import ai.asserts.inventory.TaskExecutorUtil;
import ai.asserts.inventory.TaskThreadPool;
import ai.asserts.inventory.collector.CollectionResult;
import ai.asserts.inventory.collector.CollectorRegistry;
import ai.asserts.inventory.collector.ScanScope;
import ai.asserts.inventory.model.CollectorStatus;
import ai.asserts.inventory.model.ReportSection;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.ScanStatus;
import ai.asserts.inventory.model.ScopeStatus;
import ai.asserts.inventory.model.VpcInfo;
import ai.asserts.inventory.model.VpcReport;
import com.google.common.collect.ImmutableSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.stream.Collectors;

import static ai.asserts.inventory.BeanConfiguration.API_POOL;

/**
 * Builds the report of one VPC. All VPC collectors run concurrently and a failing collector only affects its own
 * key.
 */
@Component
@Slf4j
public class VpcAggregator {
    private final CollectorRegistry collectorRegistry;
    private final TaskExecutorUtil taskExecutorUtil;
    private final TaskThreadPool apiPool;

    public VpcAggregator(CollectorRegistry collectorRegistry, TaskExecutorUtil taskExecutorUtil,
                         @Qualifier(API_POOL) TaskThreadPool apiPool) {
        this.collectorRegistry = collectorRegistry;
        this.taskExecutorUtil = taskExecutorUtil;
        this.apiPool = apiPool;
    }

    public VpcReport aggregate(ScanScope vpcScope, VpcInfo vpcInfo) {
        List<CollectorTask> tasks = collectorRegistry.collectorsFor(vpcScope.getPlan(), ImmutableSet.of(
                        ReportSection.NETWORK_COMPONENTS, ReportSection.SECURITY_GROUPS, ReportSection.VPC_RESOURCES))
                .stream()
                .map(collector -> new CollectorTask(collector, vpcScope))
                .collect(Collectors.toList());
        List<CollectionResult> results = taskExecutorUtil.invokeAll(apiPool, tasks);
        log.debug("Collected {} resource types in {}", results.size(), vpcScope);

        List<CollectionResult> network = inSection(results, ReportSection.NETWORK_COMPONENTS);
        List<CollectionResult> resources = inSection(results, ReportSection.VPC_RESOURCES);
        CollectionResult securityGroups = results.stream()
                .filter(result -> result.getType() == ResourceType.SecurityGroup)
                .findFirst()
                .orElse(null);

        SortedMap<String, CollectorStatus> statuses = ScopeResults.statusByToken(results);
        return VpcReport.builder()
                .vpcInfo(vpcInfo)
                .networkComponents(ScopeResults.entitiesByToken(network))
                .securityGroups(securityGroups != null ? securityGroups.getEntities() : null)
                .resources(ScopeResults.entitiesByToken(resources))
                .scanStatus(ScopeStatus.builder()
                        .status(ScopeResults.combine(statuses.values(), Collections.emptyList()))
                        .collectors(statuses)
                        .build())
                .build();
    }

    /**
     * Report of a VPC whose aggregation did not finish. Only the VPC info and the reason are kept.
     */
    public VpcReport failed(VpcInfo vpcInfo, ScopeStatus status) {
        return VpcReport.builder()
                .vpcInfo(vpcInfo)
                .scanStatus(status)
                .build();
    }

    private List<CollectionResult> inSection(List<CollectionResult> results, ReportSection section) {
        return results.stream()
                .filter(result -> result.getType().getSection() == section)
                .collect(Collectors.toList());
    }

    static ScanStatus statusOf(VpcReport report) {
        return report.getScanStatus() != null ? report.getScanStatus().getStatus() : ScanStatus.FAILED;
    }
}
