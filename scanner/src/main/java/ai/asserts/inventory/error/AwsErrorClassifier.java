/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.error;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.net.UnknownHostException;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps the exceptions raised by the SDK and by the task framework to a {@link ScanErrorType}. The whole cause chain is
 * examined, the first recognised exception wins.
 */
public final class AwsErrorClassifier {
    private static final Set<String> ACCESS_DENIED_CODES = ImmutableSet.of(
            "AccessDenied", "AccessDeniedException", "UnauthorizedOperation", "UnauthorizedAccess",
            "AuthorizationError");
    private static final Set<String> NOT_ENABLED_CODES = ImmutableSet.of(
            "OptInRequired", "AuthFailure", "UnrecognizedClientException", "InvalidClientTokenId",
            "SubscriptionRequiredException");
    private static final Set<String> CREDENTIALS_CODES = ImmutableSet.of(
            "ExpiredToken", "ExpiredTokenException", "SignatureDoesNotMatch", "MissingAuthenticationToken");

    private AwsErrorClassifier() {
    }

    public static ScanErrorType classify(Throwable error) {
        if (error == null) {
            return ScanErrorType.UNKNOWN;
        }
        for (Throwable t : Throwables.getCausalChain(error)) {
            if (t instanceof CancellationException || t instanceof InterruptedException) {
                return ScanErrorType.CANCELLED;
            }
            if (t instanceof TimeoutException) {
                return ScanErrorType.TIMEOUT;
            }
            if (t instanceof UnknownHostException) {
                return ScanErrorType.NOT_ENABLED;
            }
            if (t instanceof AwsServiceException) {
                return classifyServiceException((AwsServiceException) t);
            }
        }
        for (Throwable t : Throwables.getCausalChain(error)) {
            if (t instanceof SdkClientException && t.getMessage() != null
                    && t.getMessage().contains("Unable to load credentials")) {
                return ScanErrorType.CREDENTIALS;
            }
        }
        return ScanErrorType.UNKNOWN;
    }

    private static ScanErrorType classifyServiceException(AwsServiceException e) {
        if (e.isThrottlingException()) {
            return ScanErrorType.THROTTLED;
        }
        String errorCode = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        if (errorCode != null) {
            if (ACCESS_DENIED_CODES.contains(errorCode)) {
                return ScanErrorType.ACCESS_DENIED;
            }
            if (NOT_ENABLED_CODES.contains(errorCode)) {
                return ScanErrorType.NOT_ENABLED;
            }
            if (CREDENTIALS_CODES.contains(errorCode)) {
                return ScanErrorType.CREDENTIALS;
            }
        }
        if (e.statusCode() == 403) {
            return ScanErrorType.ACCESS_DENIED;
        }
        return ScanErrorType.UNKNOWN;
    }

    /**
     * A short, single line description of the failure suitable for the output document.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        for (Throwable t : Throwables.getCausalChain(error)) {
            if (t instanceof AwsServiceException) {
                AwsServiceException e = (AwsServiceException) t;
                if (e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null) {
                    return e.awsErrorDetails().errorCode() + ": " + e.awsErrorDetails().errorMessage();
                }
            }
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
