package com.eainde.athlete.llm;

import com.eainde.athlete.resilience.DependencyGuard;
import com.eainde.athlete.resilience.RetryExecutor;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.service.AiServices;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuardedChatModelTest {

    private ExecutorService executor;
    private DependencyGuard breaker;
    private final RetryExecutor retry = new RetryExecutor("llm", 3, Duration.ofMillis(1), 1.5, 0.1);

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        breaker = DependencyGuard.create("llm", 5, Duration.ofSeconds(30), Duration.ofSeconds(5), 1, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Answers from a queue of scripted replies and records every request. */
    private static final class ScriptedChatModel implements ChatModel {

        private final Deque<Supplier<String>> replies = new ArrayDeque<>();
        private final List<ChatRequest> requests = new ArrayList<>();

        ScriptedChatModel reply(String text) {
            replies.add(() -> text);
            return this;
        }

        ScriptedChatModel fail(RuntimeException error) {
            replies.add(() -> {
                throw error;
            });
            return this;
        }

        @Override
        public synchronized ChatResponse doChat(ChatRequest chatRequest) {
            requests.add(chatRequest);
            return ChatResponse.builder().aiMessage(AiMessage.from(replies.remove().get())).build();
        }
    }

    @Test
    @DisplayName("retries a transient model failure inside the breaker")
    void retriesTransientFailure() {
        ScriptedChatModel model = new ScriptedChatModel()
                .fail(new UncheckedIOException(new IOException("connection reset")))
                .reply("ok");
        GuardedChatModel guarded = new GuardedChatModel(model, breaker, retry);

        String answer = guarded.chat("hello");

        assertThat(answer).isEqualTo("ok");
        assertThat(model.requests).hasSize(2);
    }

    @Test
    @DisplayName("permanent failures reach the caller after one attempt")
    void permanentFailure() {
        ScriptedChatModel model = new ScriptedChatModel().fail(new IllegalArgumentException("bad request"));
        GuardedChatModel guarded = new GuardedChatModel(model, breaker, retry);

        assertThatThrownBy(() -> guarded.chat("hello"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad request");
        assertThat(model.requests).hasSize(1);
    }

    @Test
    @DisplayName("the classifier service renders its prompt resource and maps fenced JSON")
    void classifierService() {
        ScriptedChatModel model = new ScriptedChatModel().reply("""
                ```json
                {"topicDomain": "anti_doping", "detectedNgbIds": ["usa_track_field"], "queryIntent": "procedural",
                 "shouldEscalate": false, "hasTimeConstraint": false, "needsClarification": false,
                 "emotionalState": "neutral", "confidence": 0.9}
                ```""");
        QueryClassifier classifier = AiServices.builder(QueryClassifier.class)
                .chatModel(new GuardedChatModel(model, breaker, retry))
                .build();

        Classification result = classifier.classify("How do I file a TUE?", "anti_doping, safesport", "", "");

        assertThat(result.topicDomain()).isEqualTo("anti_doping");
        assertThat(result.detectedNgbIds()).containsExactly("usa_track_field");
        assertThat(result.queryIntent()).isEqualTo("procedural");
        List<ChatMessage> sent = model.requests.get(0).messages();
        assertThat(sent.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(((SystemMessage) sent.get(0)).text())
                .contains("one of [anti_doping, safesport]")
                .doesNotContain("{{domains}}");
    }

    @Test
    @DisplayName("the expander service reads a query list object")
    void expanderService() {
        ScriptedChatModel model = new ScriptedChatModel()
                .reply("{\"queries\": [\"therapeutic use exemption\", \"TUE application process\"]}");
        QueryExpander expander = AiServices.builder(QueryExpander.class)
                .chatModel(new GuardedChatModel(model, breaker, retry))
                .build();

        ExpandedQueries result = expander.expand("How do I file a TUE?", 3, "(none)");

        assertThat(result.queries()).containsExactly("therapeutic use exemption", "TUE application process");
    }
}
