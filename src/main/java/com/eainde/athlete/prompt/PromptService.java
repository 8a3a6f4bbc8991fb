package com.eainde.athlete.prompt;

import dev.langchain4j.model.input.PromptTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from {@code classpath:prompts/<name>.txt} and renders them with LangChain4j
 * {@link PromptTemplate}. Templates are cached after the first read. Null values render as empty
 * text; a placeholder with no value at all fails the render.
 */
@Slf4j
@Service
public class PromptService {

    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException when the template uses a variable missing from {@code variables}
     */
    public String render(String name, Map<String, ?> variables) {
        Map<String, Object> values = new HashMap<>();
        variables.forEach((key, value) -> values.put(key, value == null ? "" : value));
        return templates.computeIfAbsent(name, n -> PromptTemplate.from(template(n)))
                .apply(values)
                .text();
    }

    public String template(String name) {
        return cache.computeIfAbsent(name, this::load);
    }

    private String load(String name) {
        ClassPathResource resource = new ClassPathResource("prompts/" + name + ".txt");
        try (InputStream in = resource.getInputStream()) {
            String text = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("Loaded prompt template '{}' ({} chars)", name, text.length());
            return text;
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt template not found: " + name, e);
        }
    }
}
