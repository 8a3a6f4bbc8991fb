package com.eainde.athlete.nodes;

import com.eainde.athlete.knowledge.Disclaimers;
import com.eainde.athlete.state.RunState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Appends the domain disclaimer to the answer unless an earlier node opted out.
 */
@Slf4j
@Component
public class DisclaimerGuardNode implements AsyncNodeAction<RunState> {

    static final String SEPARATOR = "\n\n---\n\n";

    private final Disclaimers disclaimers;

    public DisclaimerGuardNode(Disclaimers disclaimers) {
        this.disclaimers = disclaimers;
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(RunState state) {
        String answer = state.getAnswer();
        if (answer == null || answer.isBlank() || !state.isDisclaimerRequired()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        String disclaimer = disclaimers.forDomain(state.getTopicDomain(), state.getEscalationCategory());
        log.debug("Appending disclaimer for domain {}", state.getTopicDomain());
        return CompletableFuture.completedFuture(Map.of(
                RunState.ANSWER, answer + SEPARATOR + disclaimer,
                RunState.DISCLAIMER, disclaimer));
    }
}
