package com.eainde.workout.retry;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognises a correct refusal: the model identified the message as not being a completed
 * workout. Such a response must not be retried.
 */
@Component
public class ValidRefusalClassifier implements ResponseClassifier {

    static final String WARNING_MARKER = "\u26A0\uFE0F";

    private static final List<Pattern> NEGATIONS = PatternGroups.compile(
            "(unable to|cannot|can'?t|couldn'?t) (log|save|record|process|extract|complete)",
            "won'?t be able to (log|save|record|process)",
            "not a (workout|completed workout|valid workout|loggable workout)",
            "this is(n't| not) a (workout|completed workout|valid workout)",
            "doesn'?t (appear|seem|look) (to be |like )?(a )?workout",
            "no (workout|performance|exercise|training) data",
            "no (actionable|loggable|extractable) (data|information)",
            "insufficient (data|information|details|context)",
            "missing (data|information|details|required|key|essential)",
            "lack(s|ing)? (sufficient |enough |the )?(data|information|details)",
            "nothing to (log|save|record|extract)",
            "no (data|information|details) to (log|save|extract)");

    private static final List<Pattern> NON_WORKOUT_CONTENT = PatternGroups.compile(
            "this is (a |an )?(planning|reflection|advice|question|inquiry)",
            "(planning|future|upcoming) (question|request|inquiry|workout|session)",
            "plan(ning)? to (do|complete|perform)",
            "(asking|seeking|looking) (for )?(advice|help|guidance|recommendations)",
            "question about (workout|training|exercise|fitness)",
            "advice (on|about|regarding|for)",
            "reflect(ion|ing) (on|about)",
            "thinking (about|back on)",
            "not (a )?(completed|finished|done) workout",
            "haven'?t (yet )?(completed|finished|done)",
            "future (workout|training|intention|plan)",
            "(tomorrow|next|later|upcoming).*(workout|training|session)",
            "going to (do|complete|perform|try)",
            "intend(ing)? to");

    private static final List<Pattern> EXPLICIT_BLOCKS = PatternGroups.compile(
            "i (can'?t|cannot|won'?t|am unable to) (log|save|record) this",
            "not (a )?valid (workout )?log",
            "no (valid |actual )?(workout|exercise) (was )?(performed|completed|done)",
            "only (log|save|record) (completed|actual|real) workouts");

    @Override
    public boolean classify(String response) {
        if (response == null || response.isBlank()) {
            return false;
        }
        if (response.contains(WARNING_MARKER) && hasWorkoutContext(response)) {
            return true;
        }
        return PatternGroups.anyMatch(NEGATIONS, response)
                || PatternGroups.anyMatch(NON_WORKOUT_CONTENT, response)
                || PatternGroups.anyMatch(EXPLICIT_BLOCKS, response);
    }

    private static boolean hasWorkoutContext(String response) {
        String lower = response.toLowerCase(Locale.ROOT);
        return lower.contains("workout") || lower.contains("log")
                || lower.contains("exercise") || lower.contains("training");
    }
}
