/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.config;

import ai.asserts.inventory.model.ResourceType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

import static org.springframework.util.StringUtils.hasLength;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressWarnings("FieldMayBeFinal")
@EqualsAndHashCode
@ToString
public class ScanConfig {
    /**
     * Regions to scan. When empty, all regions enabled for the account are scanned.
     */
    @Builder.Default
    private Set<String> regions = new TreeSet<>();

    /**
     * Resource type tokens or service aliases to leave out of the scan.
     */
    @Builder.Default
    private Set<String> exclude = new TreeSet<>();

    private String outputPath;

    @Builder.Default
    private boolean verbose = false;

    /**
     * Region used for account level calls like <code>DescribeRegions</code> and <code>ListBuckets</code>
     */
    @Builder.Default
    private String homeRegion = "us-east-1";

    @Builder.Default
    private int regionThreads = 4;

    @Builder.Default
    private int vpcThreads = 4;

    @Builder.Default
    private int apiThreads = 8;

    /**
     * Permits per second for each API operation in each region
     */
    @Builder.Default
    private double apiRateLimit = 20.0D;

    @Builder.Default
    private int sdkMaxRetries = 5;

    @Builder.Default
    private int taskTimeoutSeconds = 900;

    @Builder.Default
    private boolean collectCapacityMetrics = true;

    @Builder.Default
    private boolean prettyPrint = true;

    @JsonIgnore
    public Set<ResourceType> getExcludedTypes() {
        Set<ResourceType> excluded = EnumSet.noneOf(ResourceType.class);
        if (exclude != null) {
            exclude.forEach(token -> excluded.addAll(ResourceType.resolve(token)));
        }
        return excluded;
    }

    @JsonIgnore
    public boolean isExcluded(ResourceType type) {
        return getExcludedTypes().contains(type);
    }

    public void validateConfig() {
        if (exclude != null) {
            for (String token : exclude) {
                if (ResourceType.resolve(token).isEmpty()) {
                    throw new IllegalArgumentException("Unknown resource type [" + token + "] in exclude list");
                }
            }
        }
        if (regions != null) {
            regions.forEach(region -> {
                if (!hasLength(region) || region.trim().contains(" ")) {
                    throw new IllegalArgumentException("Invalid region [" + region + "]");
                }
            });
        }
        if (regionThreads < 1 || vpcThreads < 1 || apiThreads < 1) {
            throw new IllegalArgumentException("Thread pool sizes must be positive");
        }
        if (apiRateLimit <= 0) {
            throw new IllegalArgumentException("apiRateLimit must be positive");
        }
        if (taskTimeoutSeconds < 1) {
            throw new IllegalArgumentException("taskTimeoutSeconds must be positive");
        }
        if (!hasLength(homeRegion)) {
            throw new IllegalArgumentException("homeRegion must be specified");
        }
    }
}
