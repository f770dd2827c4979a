package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.error.MalformedResponseException;
import com.eainde.workout.error.PreconditionException;
import com.eainde.workout.model.StructuredModelClient;
import com.eainde.workout.prompt.PromptLoader;
import com.eainde.workout.repair.ResponseRepair;
import com.eainde.workout.schema.WorkoutSchemaComposer;
import com.eainde.workout.tool.output.ToolOutput;
import com.eainde.workout.tool.output.WorkoutExtraction;
import com.eainde.workout.workout.CompletionTimeResolver;
import com.eainde.workout.workout.WorkoutFields;
import com.eainde.workout.workout.WorkoutIds;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * extract_workout_data: turns the user's message into a workout candidate using the
 * discipline's schema as a forced tool. Falls back to plain JSON output when the
 * tool call fails.
 */
@Slf4j
@Component
public class ExtractWorkoutDataTool implements WorkoutTool {

    static final String GENERATE_TOOL_NAME = "generate_workout";
    static final String MISSING_DISCIPLINE =
            "discipline parameter is required - must call detect_discipline tool first";
    static final int DEFAULT_EXERTION = 5;

    private final StructuredModelClient modelClient;
    private final PromptLoader promptLoader;
    private final WorkoutSchemaComposer schemaComposer;
    private final CompletionTimeResolver completionTimeResolver;
    private final Clock clock;

    public ExtractWorkoutDataTool(StructuredModelClient modelClient,
                                  PromptLoader promptLoader,
                                  WorkoutSchemaComposer schemaComposer,
                                  CompletionTimeResolver completionTimeResolver,
                                  Clock clock) {
        this.modelClient = modelClient;
        this.promptLoader = promptLoader;
        this.schemaComposer = schemaComposer;
        this.completionTimeResolver = completionTimeResolver;
        this.clock = clock;
    }

    @Override
    public ToolId id() {
        return ToolId.EXTRACT_WORKOUT_DATA;
    }

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(id().toolName())
                .description("Extract structured workout data from the user's message. Requires the discipline "
                        + "returned by detect_discipline. Returns workoutData, completedAt and generationMethod.")
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty("discipline", "Discipline returned by detect_discipline")
                        .addStringProperty("userMessage", "The user's workout description")
                        .addStringProperty("userTimezone", "IANA timezone of the user")
                        .addStringProperty("messageTimestamp", "ISO-8601 time the message was sent")
                        .addBooleanProperty("isSlashCommand", "True when the message came from a slash command")
                        .addStringProperty("slashCommand", "The slash command, if any")
                        .addIntegerProperty(ToolInputs.WORKOUT_INDEX, "0-based index when the message has several workouts")
                        .required("discipline")
                        .build())
                .build();
    }

    @Override
    public ToolOutput execute(JsonNode input, ExtractionRun run) {
        String discipline = ToolInputs.text(input, "discipline");
        if (discipline == null) {
            throw new PreconditionException(MISSING_DISCIPLINE);
        }

        WorkoutLogRequest request = run.request();
        String userMessage = firstNonNull(ToolInputs.text(input, "userMessage"), request.getUserMessage());
        String userTimezone = firstNonNull(ToolInputs.text(input, "userTimezone"), request.getUserTimezone());
        String messageTimestamp = firstNonNull(ToolInputs.text(input, "messageTimestamp"), request.getMessageTimestamp());
        boolean slashCommand = ToolInputs.bool(input, "isSlashCommand", request.triggeredBySlashCommand());
        String slashCommandName = firstNonNull(ToolInputs.text(input, "slashCommand"), request.getSlashCommand());

        Map<String, String> variables = new HashMap<>();
        variables.put("discipline", discipline);
        variables.put("userTimezone", userTimezone);
        variables.put("messageTimestamp", messageTimestamp);
        variables.put("detectionType", slashCommand ? "slash_command" : "natural_language");
        variables.put("expectedArrayFields", String.join(", ", schemaComposer.expectedArrayFields(discipline)));

        String generationMethod = WorkoutExtraction.GENERATION_TOOL;
        ObjectNode workout;
        try {
            ToolSpecification generateTool = ToolSpecification.builder()
                    .name(GENERATE_TOOL_NAME)
                    .description("Record the structured workout")
                    .parameters(schemaComposer.composeSchema(discipline))
                    .build();
            workout = asWorkout(modelClient.callTool("workout_extraction",
                    promptLoader.render("workout-extraction", variables), userMessage, generateTool));
        } catch (RuntimeException e) {
            log.warn("Tool-based extraction failed, falling back to JSON output: {}", e.getMessage());
            generationMethod = WorkoutExtraction.GENERATION_FALLBACK;
            workout = asWorkout(modelClient.callJson("workout_extraction_fallback",
                    promptLoader.render("workout-extraction-fallback", variables), userMessage));
        }

        String extractedDiscipline = WorkoutFields.discipline(workout);
        if (extractedDiscipline == null) {
            workout.put(WorkoutFields.DISCIPLINE, discipline);
        } else if (!extractedDiscipline.equals(discipline)) {
            log.info("Extracted discipline {} differs from detected {}, keeping extracted", extractedDiscipline, discipline);
        }

        stampSystemFields(workout, request.getUserId(), generationMethod, slashCommand, slashCommandName);

        String completedAt = completionTimeResolver.resolve(userMessage, messageTimestamp, userTimezone).toString();
        log.info("Extraction completed: method={}, workoutId={}, discipline={}, completedAt={}",
                generationMethod, workout.path("workout_id").asText(), WorkoutFields.discipline(workout), completedAt);
        return new WorkoutExtraction(workout, completedAt, generationMethod, userMessage);
    }

    private static ObjectNode asWorkout(JsonNode parsed) {
        JsonNode workout = parsed.has("workout_log") ? parsed.get("workout_log") : parsed;
        if (!workout.isObject()) {
            throw new MalformedResponseException("Extracted workout is not a JSON object");
        }
        return ResponseRepair.fixDoubleEncodedProperties((ObjectNode) workout);
    }

    private void stampSystemFields(ObjectNode workout, String userId, String generationMethod,
                                   boolean slashCommand, String slashCommandName) {
        workout.put("workout_id", WorkoutIds.newWorkoutId(userId, clock));
        workout.put("user_id", userId);

        JsonNode metricsNode = workout.get(WorkoutFields.PERFORMANCE_METRICS);
        ObjectNode metrics = metricsNode instanceof ObjectNode existing
                ? existing
                : workout.putObject(WorkoutFields.PERFORMANCE_METRICS);
        defaultExertion(metrics, "intensity");
        defaultExertion(metrics, "perceived_exertion");

        ObjectNode metadata = WorkoutFields.metadata(workout);
        metadata.put("generation_method", generationMethod);
        metadata.put("generation_timestamp", Instant.now(clock).toString());
        metadata.put("logged_via", slashCommand ? "slash_command" : "conversation");
        if (slashCommand) {
            metadata.put("extraction_notes", "Logged via /" + (slashCommandName == null ? "log-workout" : slashCommandName)
                    + " command");
        }
        WorkoutFields.validationFlags(workout);
    }

    private static void defaultExertion(ObjectNode metrics, String field) {
        JsonNode value = metrics.get(field);
        if (value == null || value.isNull()) {
            metrics.put(field, DEFAULT_EXERTION);
        }
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }
}
