/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import ai.asserts.inventory.error.AwsErrorClassifier;
import ai.asserts.inventory.error.InventoryScanException;
import ai.asserts.inventory.error.ScanErrorType;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

/**
 * Verifies the credentials of the default provider chain and resolves the account they belong to.
 */
@Component
@Slf4j
public class AccountIDProvider {
    private final AWSClientProvider awsClientProvider;
    private volatile String accountId;

    public AccountIDProvider(AWSClientProvider awsClientProvider) {
        this.awsClientProvider = awsClientProvider;
    }

    /**
     * @throws InventoryScanException if the caller identity cannot be determined
     */
    public String getAccountId(String homeRegion) {
        if (accountId == null) {
            try {
                GetCallerIdentityResponse callerIdentity = getStsClient(homeRegion).getCallerIdentity();
                accountId = callerIdentity.account();
                log.info("Scanning account {} as {}", accountId, callerIdentity.arn());
            } catch (RuntimeException e) {
                ScanErrorType errorType = AwsErrorClassifier.classify(e);
                log.error("getCallerIdentity failed", e);
                throw new InventoryScanException(
                        errorType == ScanErrorType.UNKNOWN ? ScanErrorType.CREDENTIALS : errorType,
                        "Could not verify AWS credentials: " + AwsErrorClassifier.describe(e), e);
            }
        }
        return accountId;
    }

    @VisibleForTesting
    StsClient getStsClient(String region) {
        return awsClientProvider.getStsClient(region);
    }
}
