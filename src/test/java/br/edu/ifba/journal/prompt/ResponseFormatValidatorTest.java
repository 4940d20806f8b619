package br.edu.ifba.journal.prompt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ResponseFormatValidator}.
 */
class ResponseFormatValidatorTest {

    private ResponseFormatValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ResponseFormatValidator(50);
    }

    @Test
    @DisplayName("should accept one short question")
    void shouldAcceptOneQuestion() {
        FormatCheck check = validator.check("I hear you. What made today feel so heavy?");

        assertTrue(check.isValid());
        assertEquals(1, check.questionCount());
    }

    @Test
    @DisplayName("should accept an acknowledgment without a question")
    void shouldAcceptAcknowledgment() {
        assertTrue(validator.check("That's real growth. Seeing the pattern is most of the work.").isValid());
    }

    @Test
    @DisplayName("should match acknowledgment phrases with typographic apostrophes")
    void shouldNormaliseApostrophes() {
        assertTrue(validator.check("You’ve clearly thought about this a lot.").isValid());
    }

    @Test
    @DisplayName("should reject two questions")
    void shouldRejectTwoQuestions() {
        FormatCheck check = validator.check("Why do you think so? And how did it feel?");

        assertEquals(java.util.List.of(FormatCheck.Violation.MULTIPLE_QUESTIONS), check.violations());
    }

    @Test
    @DisplayName("should reject a statement that neither asks nor acknowledges")
    void shouldRejectPlainStatement() {
        FormatCheck check = validator.check("That sounds like a hard day.");

        assertTrue(check.violations().contains(FormatCheck.Violation.NO_QUESTION_OR_ACKNOWLEDGMENT));
    }

    @Test
    @DisplayName("should reject replies at or above the word ceiling")
    void shouldRejectLongReply() {
        String reply = "word ".repeat(49) + "why?";

        FormatCheck check = validator.check(reply);

        assertEquals(50, check.wordCount());
        assertTrue(check.violations().contains(FormatCheck.Violation.TOO_LONG));
    }

    @Test
    @DisplayName("should reject bulleted lists and step sequences")
    void shouldRejectListsAndSteps() {
        FormatCheck list = validator.check("Try this:\n- breathe\n- walk\nWhich feels doable?");
        FormatCheck steps = validator.check("First take a breath, second write it down. Could that help?");

        assertTrue(list.violations().contains(FormatCheck.Violation.LIST_FORMAT));
        assertTrue(steps.violations().contains(FormatCheck.Violation.STEP_SEQUENCE));
    }

    @Test
    @DisplayName("should flag an empty reply")
    void shouldFlagEmpty() {
        FormatCheck check = validator.check("   ");

        assertEquals(java.util.List.of(FormatCheck.Violation.EMPTY), check.violations());
        assertFalse(check.isValid());
    }
}
