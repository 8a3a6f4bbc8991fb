package com.eainde.athlete.config;

import com.eainde.athlete.llm.ModelRole;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalised settings for the answer pipeline, bound from the {@code agent.*} namespace.
 * Every value has a default so the application starts with an empty configuration.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private Vertex vertex = new Vertex();
    private Map<ModelRole, Model> models = new EnumMap<>(ModelRole.class);
    private Retrieval retrieval = new Retrieval();
    private Quality quality = new Quality();
    private Planner planner = new Planner();
    private Research research = new Research();
    private Deadlines deadlines = new Deadlines();
    private Graph graph = new Graph();
    private Map<String, Breaker> breakers = new LinkedHashMap<>();
    private Retry retry = new Retry();
    private Memory memory = new Memory();
    private Checkpoint checkpoint = new Checkpoint();

    /** Settings for a role, falling back to defaults when the role is not configured. */
    public Model model(ModelRole role) {
        return models.getOrDefault(role, role.defaults());
    }

    /** Settings for a named breaker. The model breaker defaults to a slower, more tolerant profile. */
    public Breaker breaker(String name) {
        Breaker configured = breakers.get(name);
        if (configured != null) {
            return configured;
        }
        return "llm".equals(name)
                ? new Breaker(3, Duration.ofSeconds(60), Duration.ofSeconds(30), 2)
                : new Breaker();
    }

    @Data
    public static class Vertex {
        private String project;
        private String location = "us-central1";
        private String embeddingModel = "text-embedding-004";
    }

    @Data
    public static class Model {
        private String name = "gemini-2.0-flash";
        private double temperature = 0.2;
        private int maxOutputTokens = 1024;

        public Model() {
        }

        public Model(String name, double temperature, int maxOutputTokens) {
            this.name = name;
            this.temperature = temperature;
            this.maxOutputTokens = maxOutputTokens;
        }
    }

    @Data
    public static class Retrieval {
        private int topK = 10;
        private int rrfK = 60;
        private double vectorWeight = 0.5;
        private double confidenceThreshold = 0.5;
        private int narrowTopK = 8;
        private int broadenMinResults = 2;
        private boolean expansionEnabled = true;
        private int expansionTopK = 5;
        private int contextCharLimit = 200;
    }

    @Data
    public static class Quality {
        private boolean enabled = true;
        private int maxRetries = 1;
        private double passThreshold = 0.6;
    }

    @Data
    public static class Planner {
        private boolean enabled = true;
        private int maxSubQueries = 4;
    }

    @Data
    public static class Research {
        private String apiKey;
        private String baseUrl = "https://api.tavily.com";
        private int maxResults = 5;
        private List<String> trustedDomains = new ArrayList<>(List.of(
                "usathlete.org", "uscenterforsafesport.org", "usada.org", "teamusa.org",
                "tas-cas.org", "olympics.com", "wada-ama.org"));
    }

    @Data
    public static class Deadlines {
        private Duration invoke = Duration.ofSeconds(60);
        private Duration stream = Duration.ofSeconds(120);
    }

    @Data
    public static class Graph {
        private int maxSteps = 25;
    }

    @Data
    public static class Breaker {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private int successThreshold = 2;

        public Breaker() {
        }

        public Breaker(int failureThreshold, Duration resetTimeout, Duration requestTimeout, int successThreshold) {
            this.failureThreshold = failureThreshold;
            this.resetTimeout = resetTimeout;
            this.requestTimeout = requestTimeout;
            this.successThreshold = successThreshold;
        }
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private double randomization = 0.5;
    }

    @Data
    public static class Memory {
        private String store = "memory";
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class Checkpoint {
        private String store = "memory";
        private Duration retention = Duration.ofDays(7);
        private Duration purgeInterval = Duration.ofHours(1);
    }
}
