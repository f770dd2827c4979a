package com.eainde.workout.agent;

/**
 * How a conversation with the model ended.
 *
 * @param finalText           the model's last text, may be null when it only ever called tools
 * @param iterations          model calls made
 * @param iterationCapReached true when the loop stopped because of the iteration limit
 */
public record ConversationOutcome(String finalText, int iterations, boolean iterationCapReached) {
}
