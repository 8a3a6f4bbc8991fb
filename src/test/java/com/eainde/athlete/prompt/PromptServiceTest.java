package com.eainde.athlete.prompt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptServiceTest {

    private final PromptService prompts = new PromptService();

    @Test
    @DisplayName("fills placeholders from the variables")
    void renders() {
        String rendered = prompts.render("conversation-summary", Map.of("previousSummary", "Asked about appeals."));

        assertThat(rendered).contains("Asked about appeals.").doesNotContain("{{");
    }

    @Test
    @DisplayName("null values render as empty text")
    void nullValue() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("previousSummary", null);

        assertThat(prompts.render("conversation-summary", variables)).doesNotContain("{{previousSummary}}");
    }

    @Test
    @DisplayName("a placeholder without a value fails the render")
    void missingVariable() {
        assertThatThrownBy(() -> prompts.render("conversation-summary", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("previousSummary");
    }

    @Test
    @DisplayName("unknown templates fail loudly")
    void unknownTemplate() {
        assertThatThrownBy(() -> prompts.template("does-not-exist"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("does-not-exist");
    }
}
