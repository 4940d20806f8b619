package br.edu.ifba.journal.prompt;

import java.util.EnumMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.context.ContextBlock;
import br.edu.ifba.journal.core.IntentLabel;

/**
 * Prompts for reply generation, greetings and corrective regeneration.
 */
public final class PromptTemplates {

    private PromptTemplates() {
    }

    public static final String STATIC_GREETING = "Welcome back. How have you been?";

    public static final String STATIC_APOLOGY = "I'm having trouble processing that right now. Could you try again?";

    static final String PERSONA = """
        You are Goldfish, a warm journaling companion who helps people explore their thoughts and
        feelings through gentle conversation.

        Open with a short conversational filler ("I see." / "Makes sense." / "Understandable." /
        "I hear you."), add a brief observation about what they shared, then ask one simple,
        gentle question that helps them look a little deeper: a pattern in their thinking, the
        feeling underneath, or what they might not be seeing.

        Use plain everyday language, no psychological jargon. Reference past entries only when
        they reveal a pattern or a contrast. If there are signs of crisis or self-harm, respond
        with empathy, say that you are limited, and suggest reaching out to a professional.""";

    private static final Map<IntentLabel, String> INTENT_GUIDANCE = new EnumMap<>(IntentLabel.class);

    static {
        INTENT_GUIDANCE.put(IntentLabel.SELF_REFLECTION,
            "Help them reflect on patterns in their own thinking.");
        INTENT_GUIDANCE.put(IntentLabel.PLANNING,
            "Explore the feelings or worries that might be shaping this plan or decision.");
        INTENT_GUIDANCE.put(IntentLabel.EMOTIONAL_RELEASE,
            "This message carries strong feelings. Help them understand what is behind them.");
        INTENT_GUIDANCE.put(IntentLabel.INSIGHT_GENERATION,
            "Notice the patterns in what they are sharing and help them make sense of the situation.");
        INTENT_GUIDANCE.put(IntentLabel.GENERAL,
            "Understand what they are feeling and thinking with an easy, open question.");
    }

    static final String TONE_GENTLE =
        "Their emotions are intense right now. Be especially soft and patient, and do not push.";

    static final String TONE_DIRECT =
        "Their emotions are manageable. You can be a little more direct and curious.";

    static final String MODE_ACKNOWLEDGE =
        "They already show clear insight. Do not ask a question. Acknowledge their progress warmly "
            + "and include one of these phrases: %s.";

    static final String MODE_PROBE = "Ask exactly one question.";

    static final String FORMAT_RULES = """
        Reply format (must follow):
        - one short paragraph, no lists, no numbered or step-by-step instructions
        - at most one question mark
        - fewer than %d words""";

    static final String CORRECTION = """
        Your previous reply broke the reply format: %s.
        Rewrite it as one short paragraph with fewer than %d words, %s""";

    public static final String GREETING_SYSTEM_PROMPT = """
        You are Goldfish, an empathetic journaling guide. Write a brief, warm welcome message
        (under 20 words) that may gently reference the user's recent journal entries. End with
        one question, for example "Welcome back. How are you feeling today?\"""";

    /**
     * System prompt for one reply: persona, intent guidance, tone, mode, context and format rules.
     */
    @NotNull
    public static String replySystemPrompt(@NotNull RoutingDecision decision, @NotNull ContextBlock context, int wordCeiling) {
        StringBuilder sb = new StringBuilder(PERSONA);
        sb.append("\n\nCurrent task: ").append(intentGuidance(decision.intent()));
        sb.append("\n").append(decision.tone() == RoutingDecision.Tone.GENTLE ? TONE_GENTLE : TONE_DIRECT);
        sb.append("\n").append(modeInstruction(decision));
        if (!context.isEmpty()) {
            sb.append("\n\n").append(context.text());
        }
        sb.append("\n\n").append(String.format(FORMAT_RULES, wordCeiling));
        return sb.toString();
    }

    /**
     * Instruction appended to the prompt when a reply has to be regenerated.
     */
    @NotNull
    public static String correction(@NotNull FormatCheck check, @NotNull RoutingDecision decision, int wordCeiling) {
        String shape = decision.acknowledges()
            ? "acknowledging their insight without a question."
            : "ending with exactly one question.";
        return String.format(CORRECTION, check.describe(), wordCeiling, shape);
    }

    @NotNull
    public static String greetingPrompt(@NotNull ContextBlock context) {
        return "Recent context from the user's journal:\n" + context.text() + "\n\nWrite the welcome message.";
    }

    @NotNull
    public static String intentGuidance(@NotNull IntentLabel intent) {
        return INTENT_GUIDANCE.get(intent);
    }

    private static String modeInstruction(RoutingDecision decision) {
        if (!decision.acknowledges()) {
            return MODE_PROBE;
        }
        return String.format(MODE_ACKNOWLEDGE, "\"" + String.join("\", \"", ResponseFormatValidator.ACKNOWLEDGMENT_PHRASES) + "\"");
    }
}
