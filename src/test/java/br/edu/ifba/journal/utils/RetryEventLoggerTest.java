package br.edu.ifba.journal.utils;

import br.edu.ifba.journal.exception.SchemaValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RetryEventLogger}: every call leaves the MDC as it found it.
 */
class RetryEventLoggerTest {

    private RetryEventLogger logger;

    @BeforeEach
    void setUp() {
        logger = new RetryEventLogger();
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("should clear retry keys after logging an attempt")
    void shouldClearAfterAttempt() {
        logger.logRetryAttempt("nlu.extract", 2, 2,
            new SchemaValidationException("bad answer", List.of("intent 'x' is not one of the five labels")));

        assertNull(MDC.get("retry.operation"));
        assertNull(MDC.get("retry.attempt"));
        assertNull(MDC.get("retry.exception"));
    }

    @Test
    @DisplayName("should accept a missing failure")
    void shouldAcceptNullFailure() {
        assertDoesNotThrow(() -> logger.logRetryExhausted("reply.generate", 2, null));
        assertNull(MDC.get("retry.operation"));
    }

    @Test
    @DisplayName("should keep unrelated MDC entries")
    void shouldKeepUnrelatedEntries() {
        MDC.put("owner", "alice");

        logger.logServedWithViolations("reply.validate", 2, "x".repeat(500));
        logger.logRetrySuccess("reply.generate", 2);

        assertEquals("alice", MDC.get("owner"));
        assertNull(MDC.get("retry.exception"));
    }
}
