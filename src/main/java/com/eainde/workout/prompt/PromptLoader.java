package com.eainde.workout.prompt;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from {@code classpath:prompts/<name>.txt} and fills
 * {@code {{placeholder}}} variables. Templates are read once and cached.
 */
@Component
public class PromptLoader {

    private static final String PROMPT_DIR = "prompts/";

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public String get(String name) {
        return cache.computeIfAbsent(name, PromptLoader::read);
    }

    public String render(String name, Map<String, String> variables) {
        String template = get(name);
        for (Map.Entry<String, String> variable : variables.entrySet()) {
            String value = variable.getValue() == null ? "" : variable.getValue();
            template = template.replace("{{" + variable.getKey() + "}}", value);
        }
        return template;
    }

    private static String read(String name) {
        String path = PROMPT_DIR + name + ".txt";
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt template not found: " + path, e);
        }
    }
}
