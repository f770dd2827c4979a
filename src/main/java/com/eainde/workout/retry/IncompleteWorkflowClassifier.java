package com.eainde.workout.retry;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognises a model that stopped to ask the user something instead of running the tools.
 * Logging is fire-and-forget, so nobody will answer.
 */
@Component
public class IncompleteWorkflowClassifier implements ResponseClassifier {

    private static final List<Pattern> REQUESTS = PatternGroups.compile(
            "(could|can|would|will) you (please )?(provide|share|tell|give|clarify|specify|confirm)",
            "please (provide|share|confirm|clarify|tell|specify|give|let me know)",
            "(need|require|looking for) (more |additional )?(information|details|data|context|specifics)");

    private static final List<Pattern> CONFIRMATIONS = PatternGroups.compile(
            "please (confirm|verify|validate|check)",
            "(confirm|verify|validate) (that|this|the|if|whether)",
            "let me know (if|when|what|which|whether|about)",
            "get back to me",
            "respond (with|when|if)",
            "await(ing)? (your|a|the) (response|reply|confirmation|answer)",
            "waiting (for|on) (your|a|the)");

    private static final List<Pattern> WAITING = PatternGroups.compile(
            "i (need|require|would need|will need) (to|more|additional)",
            "i'?d need (to|more|additional)",
            "(should|shall) i (proceed|continue|assume|go ahead|start|begin)",
            "do you want me to (proceed|continue|assume|go ahead)",
            "before i (can|could|am able to|proceed|continue)",
            "in order to (log|save|process|extract|complete)",
            "(once|when|after|if) you (provide|share|confirm|tell|give|specify)");

    private static final List<Pattern> CONDITIONALS = PatternGroups.compile(
            "if (you |this |the |that )",
            "assuming (you |this |the |that )",
            "depending on",
            "based on (your|the|what)",
            "without (more |additional |further |this |the )");

    private static final List<Pattern> DEFERRED_ACTION = PatternGroups.compile(
            "then i (can|could|will|would)",
            "i (can|could|will|would) (then|proceed|continue)");

    @Override
    public boolean classify(String response) {
        if (response == null || response.isBlank()) {
            return false;
        }
        if (response.contains("?")) {
            return true;
        }
        if (PatternGroups.anyMatch(REQUESTS, response)
                || PatternGroups.anyMatch(CONFIRMATIONS, response)
                || PatternGroups.anyMatch(WAITING, response)) {
            return true;
        }
        return PatternGroups.anyMatch(CONDITIONALS, response) && PatternGroups.anyMatch(DEFERRED_ACTION, response);
    }
}
