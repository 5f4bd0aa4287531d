/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.report;

import ai.asserts.inventory.model.AccountInventory;
import ai.asserts.inventory.model.RegionReport;
import ai.asserts.inventory.model.ResourceEntity;
import ai.asserts.inventory.model.ResourceType;
import ai.asserts.inventory.model.ScopeStatus;
import ai.asserts.inventory.model.VpcReport;
import com.google.common.base.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static ai.asserts.inventory.MetricNameUtil.SCRAPE_ERROR_COUNT_METRIC;
import static ai.asserts.inventory.MetricNameUtil.SCRAPE_LATENCY_METRIC;
import static java.lang.String.format;

/**
 * Logs the human readable summary of a finished scan.
 */
@Component
@Slf4j
public class SummaryReporter {
    private static final String RULER = Strings.repeat("=", 60);
    private final MeterRegistry meterRegistry;

    public SummaryReporter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public String report(AccountInventory inventory, InventorySummary summary, Path output) {
        StringBuilder text = new StringBuilder("\n").append(RULER).append("\nAWS RESOURCE INVENTORY SUMMARY\n")
                .append(RULER).append('\n');
        if (inventory.getScanMetadata() != null) {
            text.append(format("Account: %s%s%n", inventory.getScanMetadata().getAccountId(),
                    inventory.getScanMetadata().isCancelled() ? " (cancelled, inventory is incomplete)" : ""));
        }
        text.append(format("Status: %s%n", statusOf(inventory.getScanStatus())));
        text.append(format("Regions: %d (%d failed), VPCs: %d, collectors partial: %d, failed: %d%n",
                summary.getRegionCount(), summary.getFailedRegionCount(), summary.getVpcCount(),
                summary.getPartialCollectorCount(), summary.getFailedCollectorCount()));

        text.append(format("%n%-20s %8s %16s %12s %12s %12s %8s%n", "Type", "Count", "Size (bytes)",
                "Alloc (GB)", "Items", "Objects", "No data"));
        for (ResourceType type : ResourceType.values()) {
            ResourceTypeSummary typeSummary = summary.getTypes().get(type);
            if (typeSummary == null) {
                continue;
            }
            text.append(format("%-20s %8d %16d %12d %12d %12d %8d%n", type.getToken(), typeSummary.getCount(),
                    typeSummary.getSizeBytes(), typeSummary.getAllocatedStorageGb(), typeSummary.getItemCount(),
                    typeSummary.getObjectCount(), typeSummary.getMissingMetrics()));
        }

        text.append("\nGlobal:\n");
        appendEntityCounts(text, "  ", inventory.getGlobalResources());
        if (inventory.getRegions() != null) {
            for (Map.Entry<String, RegionReport> entry : inventory.getRegions().entrySet()) {
                RegionReport region = entry.getValue();
                text.append(format("%nRegion: %s [%s]%n", entry.getKey(), statusOf(region.getScanStatus())));
                if (region.getRegionWide() != null) {
                    text.append("  Region-wide:\n");
                    appendEntityCounts(text, "    ", region.getRegionWide());
                }
                if (region.getVpcs() == null) {
                    continue;
                }
                for (Map.Entry<String, VpcReport> vpcEntry : region.getVpcs().entrySet()) {
                    VpcReport vpc = vpcEntry.getValue();
                    text.append(format("  VPC: %s [%s]%n", vpcEntry.getKey(), statusOf(vpc.getScanStatus())));
                    appendEntityCounts(text, "    ", vpc.getNetworkComponents());
                    if (vpc.getSecurityGroups() != null) {
                        text.append(format("    %s: %d%n", ResourceType.SecurityGroup.getToken(),
                                vpc.getSecurityGroups().size()));
                    }
                    appendEntityCounts(text, "    ", vpc.getResources());
                }
            }
        }

        text.append(format("%nAWS API calls: %d, errors: %d%n", apiCallCount(), apiErrorCount()));
        if (output != null) {
            text.append(format("Output: %s%n", output.toAbsolutePath()));
        }
        text.append(RULER);
        String report = text.toString();
        log.info(report);
        return report;
    }

    private void appendEntityCounts(StringBuilder text, String indent, Map<String, List<ResourceEntity>> entities) {
        if (entities != null) {
            entities.forEach((token, list) -> text.append(format("%s%s: %d%n", indent, token, list.size())));
        }
    }

    private String statusOf(ScopeStatus scopeStatus) {
        if (scopeStatus == null || scopeStatus.getStatus() == null) {
            return "UNKNOWN";
        }
        return scopeStatus.getErrorType() != null ?
                scopeStatus.getStatus() + ", " + scopeStatus.getErrorType() : scopeStatus.getStatus().name();
    }

    private long apiCallCount() {
        return meterRegistry.find(SCRAPE_LATENCY_METRIC).timers().stream()
                .mapToLong(Timer::count)
                .sum();
    }

    private long apiErrorCount() {
        return (long) meterRegistry.find(SCRAPE_ERROR_COUNT_METRIC).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
