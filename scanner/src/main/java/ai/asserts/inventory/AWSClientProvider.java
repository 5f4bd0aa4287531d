/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.efs.EfsClient;
import software.amazon.awssdk.services.fsx.FSxClient;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.redshift.RedshiftClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sts.StsClient;

import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Builds and caches the SDK clients, one per region and client type. Credentials come from the SDK's default
 * provider chain. Retries with backoff for throttling and transient errors are left to the SDK's retry policy.
 */
@Component
@Slf4j
public class AWSClientProvider implements DisposableBean {
    private final Cache<ClientCacheKey, SdkClient> clientCache;
    private final int maxRetries;

    public AWSClientProvider(ScanConfigProvider scanConfigProvider) {
        this(scanConfigProvider.getScanConfig().getSdkMaxRetries());
    }

    @VisibleForTesting
    AWSClientProvider(int maxRetries) {
        this.maxRetries = maxRetries;
        this.clientCache = CacheBuilder.newBuilder()
                .removalListener(removalNotification -> {
                    try {
                        SdkClient sdkClient = (SdkClient) removalNotification.getValue();
                        log.debug("Shutting down SDK Client {}", sdkClient.serviceName());
                        sdkClient.close();
                    } catch (Exception e) {
                        log.error("Failed to close client", e);
                    }
                })
                .build();
    }

    public Ec2Client getEc2Client(String region) {
        return getClient(region, Ec2Client.class, Ec2Client::builder);
    }

    public RdsClient getRDSClient(String region) {
        return getClient(region, RdsClient.class, RdsClient::builder);
    }

    public EfsClient getEfsClient(String region) {
        return getClient(region, EfsClient.class, EfsClient::builder);
    }

    public FSxClient getFSxClient(String region) {
        return getClient(region, FSxClient.class, FSxClient::builder);
    }

    public RedshiftClient getRedshiftClient(String region) {
        return getClient(region, RedshiftClient.class, RedshiftClient::builder);
    }

    public DynamoDbClient getDynamoDBClient(String region) {
        return getClient(region, DynamoDbClient.class, DynamoDbClient::builder);
    }

    public S3Client getS3Client(String region) {
        return getClient(region, S3Client.class, S3Client::builder);
    }

    public CloudWatchClient getCloudWatchClient(String region) {
        return getClient(region, CloudWatchClient.class, CloudWatchClient::builder);
    }

    public StsClient getStsClient(String region) {
        return getClient(region, StsClient.class, StsClient::builder);
    }

    @Override
    public void destroy() {
        clientCache.invalidateAll();
    }

    private <C extends SdkClient> C getClient(String region, Class<C> clientType,
                                              Supplier<? extends AwsClientBuilder<?, C>> builderSupplier) {
        ClientCacheKey clientCacheKey = ClientCacheKey.builder()
                .region(region)
                .clientType(clientType)
                .build();
        try {
            return clientType.cast(clientCache.get(clientCacheKey, () -> {
                AwsClientBuilder<?, C> clientBuilder = builderSupplier.get();
                clientBuilder.region(Region.of(region));
                clientBuilder.overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.builder().numRetries(maxRetries).build())
                        .build());
                return clientBuilder.build();
            }));
        } catch (ExecutionException | UncheckedExecutionException e) {
            throw new IllegalStateException("Failed to build " + clientType.getSimpleName() + " for " + region,
                    e.getCause());
        }
    }

    @EqualsAndHashCode
    @Getter
    @AllArgsConstructor
    @Builder
    public static class ClientCacheKey {
        private final String region;
        private final Class<?> clientType;
    }
}
