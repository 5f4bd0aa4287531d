/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import ai.asserts.inventory.config.ScanConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@SuppressWarnings("unused")
public class BeanConfiguration {
    public static final String REGION_POOL = "region-scan-thread-pool";
    public static final String VPC_POOL = "vpc-scan-thread-pool";
    public static final String API_POOL = "aws-api-calls-thread-pool";

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public AWSApiCallRateLimiter awsApiCallRateLimiter(MeterRegistry meterRegistry,
                                                       ScanConfigProvider scanConfigProvider) {
        return new AWSApiCallRateLimiter(meterRegistry, scanConfigProvider.getScanConfig().getApiRateLimit());
    }

    @Bean(value = REGION_POOL, destroyMethod = "shutdown")
    public TaskThreadPool regionScanPool(MeterRegistry meterRegistry, ScanConfigProvider scanConfigProvider) {
        ScanConfig scanConfig = scanConfigProvider.getScanConfig();
        return new TaskThreadPool(REGION_POOL, scanConfig.getRegionThreads(), meterRegistry);
    }

    @Bean(value = VPC_POOL, destroyMethod = "shutdown")
    public TaskThreadPool vpcScanPool(MeterRegistry meterRegistry, ScanConfigProvider scanConfigProvider) {
        ScanConfig scanConfig = scanConfigProvider.getScanConfig();
        return new TaskThreadPool(VPC_POOL, scanConfig.getVpcThreads(), meterRegistry);
    }

    @Bean(value = API_POOL, destroyMethod = "shutdown")
    public TaskThreadPool awsAPICallsPool(MeterRegistry meterRegistry, ScanConfigProvider scanConfigProvider) {
        ScanConfig scanConfig = scanConfigProvider.getScanConfig();
        return new TaskThreadPool(API_POOL, scanConfig.getApiThreads(), meterRegistry);
    }
}
