package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.model.StructuredModelClient;
import com.eainde.workout.prompt.PromptLoader;
import com.eainde.workout.schema.WorkoutSchemaComposer;
import com.eainde.workout.tool.output.DisciplineDetection;
import com.eainde.workout.tool.output.ToolOutput;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * detect_discipline: classifies the training discipline before extraction.
 * Never fails; anything that goes wrong yields {@code hybrid} at confidence 0.5.
 */
@Slf4j
@Component
public class DetectDisciplineTool implements WorkoutTool {

    static final String FALLBACK_DISCIPLINE = "hybrid";
    static final double FALLBACK_CONFIDENCE = 0.5;
    static final String METHOD_FALLBACK = "fallback";

    private final StructuredModelClient modelClient;
    private final PromptLoader promptLoader;
    private final WorkoutSchemaComposer schemaComposer;
    private final double lowConfidenceThreshold;
    private final ToolSpecification classifyTool;

    public DetectDisciplineTool(StructuredModelClient modelClient,
                                PromptLoader promptLoader,
                                WorkoutSchemaComposer schemaComposer,
                                @Value("${workout-logger.detection.low-confidence-threshold:0.65}") double lowConfidenceThreshold) {
        this.modelClient = modelClient;
        this.promptLoader = promptLoader;
        this.schemaComposer = schemaComposer;
        this.lowConfidenceThreshold = lowConfidenceThreshold;
        this.classifyTool = ToolSpecification.builder()
                .name("classify_discipline")
                .description("Return the primary training discipline of the workout")
                .parameters(JsonObjectSchema.builder()
                        .addProperty("discipline", JsonEnumSchema.builder()
                                .enumValues(schemaComposer.supportedDisciplines())
                                .build())
                        .addNumberProperty("confidence", "Confidence between 0 and 1")
                        .addStringProperty("reasoning", "One sentence explaining the classification")
                        .required("discipline", "confidence", "reasoning")
                        .build())
                .build();
    }

    @Override
    public ToolId id() {
        return ToolId.DETECT_DISCIPLINE;
    }

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(id().toolName())
                .description("Detect the training discipline of the workout. ALWAYS call this first, "
                        + "before extract_workout_data.")
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty("userMessage", "The user's workout description")
                        .addIntegerProperty(ToolInputs.WORKOUT_INDEX, "0-based index when the message has several workouts")
                        .required("userMessage")
                        .build())
                .build();
    }

    @Override
    public ToolOutput execute(JsonNode input, ExtractionRun run) {
        String userMessage = ToolInputs.text(input, "userMessage");
        if (userMessage == null) {
            userMessage = run.request().getUserMessage();
        }

        DisciplineDetection detection;
        try {
            JsonNode answer = modelClient.callTool("discipline_detection",
                    promptLoader.get("discipline-detection"), userMessage, classifyTool);
            detection = toDetection(answer);
        } catch (RuntimeException e) {
            log.warn("Discipline detection failed, defaulting to {}: {}", FALLBACK_DISCIPLINE, e.getMessage());
            return new DisciplineDetection(FALLBACK_DISCIPLINE, FALLBACK_CONFIDENCE, METHOD_FALLBACK,
                    "Detection failed, defaulted to " + FALLBACK_DISCIPLINE + ": " + e.getMessage());
        }

        if (detection.confidence() < lowConfidenceThreshold && !FALLBACK_DISCIPLINE.equals(detection.discipline())) {
            log.info("Low detection confidence {} for {}, using {}", detection.confidence(),
                    detection.discipline(), FALLBACK_DISCIPLINE);
            return new DisciplineDetection(FALLBACK_DISCIPLINE, detection.confidence(), detection.method(),
                    detection.reasoning() + " (low confidence " + detection.discipline()
                            + " classification, using " + FALLBACK_DISCIPLINE + ")");
        }
        log.info("Detected discipline {} (confidence {})", detection.discipline(), detection.confidence());
        return detection;
    }

    private DisciplineDetection toDetection(JsonNode answer) {
        String discipline = answer.path("discipline").asText("").trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        double confidence = answer.path("confidence").asDouble(FALLBACK_CONFIDENCE);
        String reasoning = answer.path("reasoning").asText("");

        if (!schemaComposer.supportedDisciplines().contains(discipline)) {
            log.warn("Model returned unsupported discipline '{}'", discipline);
            return new DisciplineDetection(FALLBACK_DISCIPLINE, FALLBACK_CONFIDENCE, DisciplineDetection.METHOD_AI,
                    "Unsupported discipline '" + discipline + "', defaulted to " + FALLBACK_DISCIPLINE);
        }
        return new DisciplineDetection(discipline, Math.max(0.0, Math.min(1.0, confidence)),
                DisciplineDetection.METHOD_AI, reasoning);
    }
}
