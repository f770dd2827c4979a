package com.eainde.workout.schema;

import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import java.util.List;

/**
 * Source of the extraction schema, narrowed to one discipline.
 */
public interface WorkoutSchemaComposer {

    /**
     * Base workout fields plus the discipline-specific block for {@code discipline}.
     * Unknown disciplines get the fallback discipline's block instead of an error.
     */
    JsonObjectSchema composeSchema(String discipline);

    /**
     * Names of the array-valued fields the discipline's block declares, e.g. {@code ["rounds"]}
     * for crossfit. Empty for unknown disciplines.
     */
    List<String> expectedArrayFields(String discipline);

    List<String> supportedDisciplines();
}
