package com.eainde.athlete.controller;

import com.eainde.athlete.checkpoint.Checkpoint;
import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.stream.AgentStreamEvent;
import com.eainde.athlete.workflow.AgentRequest;
import com.eainde.athlete.workflow.AgentResponse;
import com.eainde.athlete.workflow.AgentRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

@Slf4j
@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final AgentRunner runner;
    private final Executor sseExecutor;
    private final long emitterTimeoutMillis;

    public ChatController(AgentRunner runner,
                          @Qualifier("sseExecutor") Executor sseExecutor,
                          AgentProperties properties) {
        this.runner = runner;
        this.sseExecutor = sseExecutor;
        this.emitterTimeoutMillis = properties.getDeadlines().getStream().plusSeconds(10).toMillis();
    }

    @PostMapping
    public AgentResponse chat(@RequestBody AgentRequest request) {
        return runner.invoke(request);
    }

    /**
     * One SSE event per {@link AgentStreamEvent}: the event name is the type and the data is the
     * event as JSON. The run is cancelled when the client goes away.
     */
    @PostMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestBody AgentRequest request) {
        Stream<AgentStreamEvent> events = runner.stream(request);
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        AtomicBoolean clientGone = new AtomicBoolean();
        emitter.onCompletion(() -> clientGone.set(true));
        emitter.onTimeout(() -> clientGone.set(true));
        emitter.onError(e -> clientGone.set(true));

        sseExecutor.execute(() -> pump(events, emitter, clientGone));
        return emitter;
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<Map<String, Object>> runStatus(@PathVariable String runId) {
        return runner.latestCheckpoint(runId)
                .map(ChatController::describe)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private void pump(Stream<AgentStreamEvent> events, SseEmitter emitter, AtomicBoolean clientGone) {
        try (events) {
            Iterator<AgentStreamEvent> iterator = events.iterator();
            while (!clientGone.get() && iterator.hasNext()) {
                AgentStreamEvent event = iterator.next();
                emitter.send(SseEmitter.event()
                        .name(event.type().wireName())
                        .data(event, MediaType.APPLICATION_JSON));
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("Client disconnected from stream: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Stream delivery failed", e);
            emitter.completeWithError(e);
        }
    }

    private static Map<String, Object> describe(Checkpoint checkpoint) {
        return Map.of(
                "runId", checkpoint.threadId(),
                "step", checkpoint.step(),
                "node", checkpoint.node(),
                "updatedAt", checkpoint.createdAt().toString());
    }
}
