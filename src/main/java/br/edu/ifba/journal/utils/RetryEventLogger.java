package br.edu.ifba.journal.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for retries, regenerations and served-but-flagged outputs.
 *
 * <p>Sets MDC keys for the duration of each log call so log processors can aggregate by
 * operation:</p>
 * <ul>
 *   <li>{@code retry.operation}: e.g. {@code "nlu.extract"}, {@code "reply.generate"}</li>
 *   <li>{@code retry.attempt}: attempt number, starting at 1</li>
 *   <li>{@code retry.exception}: simple name of the failure, or the violation kind</li>
 * </ul>
 */
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    private static final String MDC_RETRY_OPERATION = "retry.operation";
    private static final String MDC_RETRY_ATTEMPT = "retry.attempt";
    private static final String MDC_RETRY_EXCEPTION = "retry.exception";

    private static final int MAX_MESSAGE_LENGTH = 200;

    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        final String message = failure != null ? failure.getMessage() : "no message";

        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(attempt));
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);

            logger.info("Retry attempt {}/{} for {}: {} - {}",
                attempt, maxAttempts, operation, exceptionName, truncateMessage(message));
        } finally {
            clearMDC();
        }
    }

    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        final String exceptionName = failure != null ? failure.getClass().getSimpleName() : "unknown";
        final String message = failure != null ? failure.getMessage() : "no message";

        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            MDC.put(MDC_RETRY_EXCEPTION, exceptionName);

            logger.warn("Retry exhausted for {} after {} attempts: {} - {}",
                operation, totalAttempts, exceptionName, truncateMessage(message));
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs an output that is served although it still breaks its contract.
     */
    public void logServedWithViolations(final String operation, final int totalAttempts, final String violations) {
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));
            MDC.put(MDC_RETRY_EXCEPTION, "FormatContractViolation");

            logger.warn("Serving flagged output for {} after {} attempts: {}",
                operation, totalAttempts, truncateMessage(violations));
        } finally {
            clearMDC();
        }
    }

    public void logRetrySuccess(final String operation, final int totalAttempts) {
        try {
            MDC.put(MDC_RETRY_OPERATION, operation);
            MDC.put(MDC_RETRY_ATTEMPT, String.valueOf(totalAttempts));

            if (totalAttempts > 1) {
                logger.info("Retry succeeded for {} on attempt {}", operation, totalAttempts);
            }
        } finally {
            clearMDC();
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_RETRY_OPERATION);
        MDC.remove(MDC_RETRY_ATTEMPT);
        MDC.remove(MDC_RETRY_EXCEPTION);
    }

    private String truncateMessage(final String message) {
        if (message == null) {
            return "null";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
