package br.edu.ifba.journal.prompt;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.ExtractedFact;

/**
 * Picks template, tone and reply mode for a message.
 */
public class IntentRouter {

    private static final Logger logger = LoggerFactory.getLogger(IntentRouter.class);

    private final int gentleIntensity;
    private final double acknowledgeThreshold;
    private final SelfAwarenessDetector selfAwarenessDetector;

    /**
     * @param gentleIntensity emotion intensity (1-5) from which the gentle tone is used
     * @param acknowledgeThreshold self-awareness score (0-1) from which the reply acknowledges
     */
    public IntentRouter(int gentleIntensity, double acknowledgeThreshold, @NotNull SelfAwarenessDetector selfAwarenessDetector) {
        this.gentleIntensity = gentleIntensity;
        this.acknowledgeThreshold = acknowledgeThreshold;
        this.selfAwarenessDetector = selfAwarenessDetector;
    }

    @NotNull
    public RoutingDecision route(@NotNull String message, @NotNull ExtractedFact facts) {
        RoutingDecision.Tone tone = facts.maxIntensity() >= gentleIntensity
            ? RoutingDecision.Tone.GENTLE
            : RoutingDecision.Tone.DIRECT;

        double selfAwareness = selfAwarenessDetector.score(message);
        RoutingDecision.Mode mode = selfAwareness >= acknowledgeThreshold
            ? RoutingDecision.Mode.ACKNOWLEDGE
            : RoutingDecision.Mode.PROBE;

        RoutingDecision decision = new RoutingDecision(facts.intent(), tone, mode, selfAwareness);
        logger.debug("Routed message: intent={}, tone={}, mode={}, selfAwareness={}",
            decision.intent().label(), tone, mode, selfAwareness);
        return decision;
    }
}
