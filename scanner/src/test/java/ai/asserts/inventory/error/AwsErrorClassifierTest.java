/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.error;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;

import java.net.UnknownHostException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AwsErrorClassifierTest {
    @Test
    public void classify_errorCodes() {
        assertEquals(ScanErrorType.ACCESS_DENIED, AwsErrorClassifier.classify(ec2Exception("UnauthorizedOperation",
                403)));
        assertEquals(ScanErrorType.NOT_ENABLED, AwsErrorClassifier.classify(ec2Exception("OptInRequired", 401)));
        assertEquals(ScanErrorType.NOT_ENABLED, AwsErrorClassifier.classify(ec2Exception("AuthFailure", 401)));
        assertEquals(ScanErrorType.CREDENTIALS, AwsErrorClassifier.classify(ec2Exception("ExpiredToken", 400)));
        assertEquals(ScanErrorType.THROTTLED, AwsErrorClassifier.classify(ec2Exception("RequestLimitExceeded",
                503)));
        assertEquals(ScanErrorType.ACCESS_DENIED, AwsErrorClassifier.classify(ec2Exception("SomethingElse", 403)));
        assertEquals(ScanErrorType.UNKNOWN, AwsErrorClassifier.classify(ec2Exception("InternalError", 500)));
    }

    @Test
    public void classify_causeChain() {
        assertEquals(ScanErrorType.ACCESS_DENIED, AwsErrorClassifier.classify(
                new ExecutionException(ec2Exception("UnauthorizedOperation", 403))));
        assertEquals(ScanErrorType.NOT_ENABLED, AwsErrorClassifier.classify(
                SdkClientException.create("Unable to execute HTTP request", new UnknownHostException("ec2"))));
        assertEquals(ScanErrorType.CREDENTIALS, AwsErrorClassifier.classify(
                SdkClientException.create("Unable to load credentials from any of the providers")));
    }

    @Test
    public void classify_taskFailures() {
        assertEquals(ScanErrorType.TIMEOUT, AwsErrorClassifier.classify(new TimeoutException()));
        assertEquals(ScanErrorType.CANCELLED, AwsErrorClassifier.classify(new CancellationException()));
        assertEquals(ScanErrorType.CANCELLED, AwsErrorClassifier.classify(new InterruptedException()));
        assertEquals(ScanErrorType.UNKNOWN, AwsErrorClassifier.classify(new IllegalStateException()));
        assertEquals(ScanErrorType.UNKNOWN, AwsErrorClassifier.classify(null));
    }

    @Test
    public void describe() {
        assertEquals("UnauthorizedOperation: not allowed",
                AwsErrorClassifier.describe(new RuntimeException(ec2Exception("UnauthorizedOperation", 403))));
        assertEquals("boom", AwsErrorClassifier.describe(new IllegalStateException("boom")));
        assertEquals("TimeoutException", AwsErrorClassifier.describe(new TimeoutException()));
    }

    private AwsServiceException ec2Exception(String errorCode, int statusCode) {
        return Ec2Exception.builder()
                .statusCode(statusCode)
                .awsErrorDetails(AwsErrorDetails.builder()
                        .errorCode(errorCode)
                        .errorMessage("not allowed")
                        .build())
                .build();
    }
}
