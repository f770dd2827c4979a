package com.eainde.workout.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Composes extraction schemas from {@code schemas/base-workout.json} and one plugin from
 * {@code schemas/disciplines/<discipline>.json}. Sending one plugin instead of the whole
 * catalogue keeps the tool definition small.
 */
@Slf4j
@Component
public class ClasspathWorkoutSchemaComposer implements WorkoutSchemaComposer {

    static final String FALLBACK_DISCIPLINE = "crossfit";

    private static final List<String> DISCIPLINES = List.of(
            "crossfit", "powerlifting", "bodybuilding", "running", "hyrox", "olympic_weightlifting",
            "functional_bodybuilding", "calisthenics", "circuit_training", "hybrid");

    private final ObjectMapper objectMapper;
    private final ObjectNode baseSchema;
    private final Map<String, ObjectNode> plugins;
    private final Map<String, JsonObjectSchema> composed = new ConcurrentHashMap<>();

    public ClasspathWorkoutSchemaComposer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.baseSchema = (ObjectNode) load("schemas/base-workout.json");
        Map<String, ObjectNode> loaded = new LinkedHashMap<>();
        for (String discipline : DISCIPLINES) {
            loaded.put(discipline, (ObjectNode) load("schemas/disciplines/" + discipline + ".json"));
        }
        this.plugins = Collections.unmodifiableMap(loaded);
        log.info("Loaded workout schema plugins: {}", plugins.keySet());
    }

    @Override
    public JsonObjectSchema composeSchema(String discipline) {
        String key = plugins.containsKey(discipline) ? discipline : FALLBACK_DISCIPLINE;
        if (!key.equals(discipline)) {
            log.warn("No schema plugin for discipline '{}', using {} schema", discipline, FALLBACK_DISCIPLINE);
        }
        return composed.computeIfAbsent(key, this::compose);
    }

    @Override
    public List<String> expectedArrayFields(String discipline) {
        ObjectNode plugin = plugins.get(discipline);
        if (plugin == null) {
            return List.of();
        }
        JsonNode properties = plugin.path(discipline).path("properties");
        List<String> arrayFields = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("array".equals(field.getValue().path("type").asText())) {
                arrayFields.add(field.getKey());
            }
        }
        return arrayFields;
    }

    @Override
    public List<String> supportedDisciplines() {
        return DISCIPLINES;
    }

    private JsonObjectSchema compose(String discipline) {
        ObjectNode schema = baseSchema.deepCopy();
        ObjectNode disciplineSpecific = ((ObjectNode) schema.get("properties"))
                .putObject("discipline_specific");
        disciplineSpecific.put("type", "object");
        disciplineSpecific.put("description", "Discipline-specific data for " + discipline + " workouts");
        disciplineSpecific.set("properties", plugins.get(discipline).deepCopy());

        log.debug("Composed schema for {} ({} chars)", discipline, schema.toString().length());
        return JsonSchemaConverter.toObjectSchema(schema);
    }

    private JsonNode load(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load schema resource " + path, e);
        }
    }
}
