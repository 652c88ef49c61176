package com.sensor.readings.reshaper.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.NoSuchFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.exception.PermanentTransferException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Service for classifying object store exceptions into failure types.
 *
 * Classification decides whether an upload attempt is worth repeating:
 * - THROTTLED: HTTP 429, SlowDown or throttling error codes
 * - NETWORK_ISSUE: connection, DNS and timeout problems, HTTP 408
 * - SERVER_ERROR: HTTP 5xx
 * - CLIENT_ERROR: other HTTP 4xx such as AccessDenied or NoSuchBucket
 * - LOCAL_FILE_ERROR: the local artifact is missing or unreadable
 * - TRANSIENT: anything else, retried
 *
 * @see TransferService
 */
@Service
public class TransferExceptionClassifier {

    private static final Logger logger = LoggerFactory.getLogger(TransferExceptionClassifier.class);

    /**
     * Failure types with their retry decision.
     */
    public enum FailureType {
        THROTTLED(true),
        NETWORK_ISSUE(true),
        SERVER_ERROR(true),
        TRANSIENT(true),
        CLIENT_ERROR(false),
        LOCAL_FILE_ERROR(false);

        private final boolean retryable;

        FailureType(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    /**
     * Classifies an exception raised by an object store call.
     *
     * @param exception the exception to classify
     * @return the failure type
     */
    public FailureType classify(Throwable exception) {
        FailureType type = doClassify(exception);
        logger.debug("Classified {} as {}", exception == null ? "null" : exception.getClass().getSimpleName(), type);
        return type;
    }

    private FailureType doClassify(Throwable exception) {
        if (exception == null) {
            return FailureType.TRANSIENT;
        }
        if (exception instanceof PermanentTransferException) {
            return FailureType.CLIENT_ERROR;
        }
        if (isLocalFileError(exception)) {
            return FailureType.LOCAL_FILE_ERROR;
        }
        if (exception instanceof AwsServiceException serviceException) {
            return classifyServiceException(serviceException);
        }
        if (exception instanceof SdkClientException || isNetworkCause(exception)) {
            return FailureType.NETWORK_ISSUE;
        }
        return FailureType.TRANSIENT;
    }

    private FailureType classifyServiceException(AwsServiceException exception) {
        int status = exception.statusCode();
        String errorCode = exception.awsErrorDetails() != null
            && exception.awsErrorDetails().errorCode() != null
            ? exception.awsErrorDetails().errorCode() : "";

        if (exception.isThrottlingException()
            || status == 429
            || errorCode.contains("SlowDown")
            || errorCode.contains("Throttl")) {
            return FailureType.THROTTLED;
        }
        if (status == 408 || errorCode.contains("RequestTimeout")) {
            return FailureType.NETWORK_ISSUE;
        }
        if (status >= 500) {
            return FailureType.SERVER_ERROR;
        }
        if (status >= 400) {
            return FailureType.CLIENT_ERROR;
        }
        return FailureType.TRANSIENT;
    }

    private boolean isLocalFileError(Throwable exception) {
        if (exception instanceof NoSuchFileException) {
            return true;
        }
        return exception instanceof UncheckedIOException
            && exception.getCause() instanceof NoSuchFileException;
    }

    private boolean isNetworkCause(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof SocketTimeoutException
                || current instanceof ConnectException
                || current instanceof UnknownHostException
                || (current instanceof IOException && !(current instanceof NoSuchFileException))) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
