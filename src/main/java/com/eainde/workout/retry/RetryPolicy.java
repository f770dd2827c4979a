package com.eainde.workout.retry;

import com.eainde.workout.api.WorkoutLogResult;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.tool.output.ValidationVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a run that saved nothing deserves one more attempt with a stricter prompt.
 * Only a run where no tool succeeded and the model asked for input qualifies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryPolicy {

    private final ValidRefusalClassifier refusalClassifier;
    private final IncompleteWorkflowClassifier incompleteClassifier;

    public boolean shouldRetry(WorkoutLogResult result, String response, ResultStore results) {
        if (result.isSuccess()) {
            return false;
        }
        if (result.getBlockingFlags() != null && !result.getBlockingFlags().isEmpty()) {
            log.info("Not retrying, validation blocked with flags {}", result.getBlockingFlags());
            return false;
        }
        boolean validationBlocked = results.read(ResultRole.VALIDATION, null, ValidationVerdict.class)
                .map(verdict -> !verdict.blockingFlags().isEmpty())
                .orElse(false);
        if (validationBlocked) {
            return false;
        }
        if (refusalClassifier.classify(response)) {
            log.info("Not retrying, model correctly refused non-workout content");
            return false;
        }
        boolean retry = results.successfulCount() == 0 && incompleteClassifier.classify(response);
        if (retry) {
            log.info("Model asked for input without running tools, retrying with a stricter prompt");
        }
        return retry;
    }
}
