package com.knowledge.curation.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.curation.core.JsonSupport;
import com.knowledge.curation.provider.ProviderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Adjudicator backed by a local Ollama server.
 *
 * Ollama must be running (default: http://localhost:11434) with the model pulled.
 *
 * Usage:
 * <pre>
 * OllamaLLMAdjudicator adjudicator = OllamaLLMAdjudicator.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaLLMAdjudicator implements LLMAdjudicator {
    private static final Logger log = LoggerFactory.getLogger(OllamaLLMAdjudicator.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AdjudicationPromptBuilder promptBuilder;
    private final AdjudicationResponseParser responseParser;

    private OllamaLLMAdjudicator(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = JsonSupport.newObjectMapper();
        this.promptBuilder = builder.promptBuilder != null ? builder.promptBuilder : new AdjudicationPromptBuilder();
        this.responseParser = new AdjudicationResponseParser();
    }

    @Override
    public AdjudicationDecision decide(AdjudicationRequest request) {
        log.info("llm.adjudicating communityId={} size={} model={}",
                request.community().id(), request.community().size(), model);
        String prompt = promptBuilder.build(request);
        String reply = callOllama(prompt);
        return responseParser.parse(reply, request.allowedIds());
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("llm.unavailable baseUrl={} error={}", baseUrl, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String callOllama(String prompt) {
        try {
            String requestBody = objectMapper.writeValueAsString(new OllamaRequest(model, prompt, false, "json"));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/generate"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ProviderUnavailableException(getProviderName(),
                        "Ollama returned status " + response.statusCode() + ": " + response.body());
            }
            OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
            log.debug("llm.reply-received model={} length={}", model,
                    ollamaResponse.response() != null ? ollamaResponse.response().length() : 0);
            return ollamaResponse.response();
        } catch (IOException e) {
            throw new ProviderUnavailableException(getProviderName(), "call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(getProviderName(), "call interrupted", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;
        private AdjudicationPromptBuilder promptBuilder;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder promptBuilder(AdjudicationPromptBuilder promptBuilder) {
            this.promptBuilder = promptBuilder;
            return this;
        }

        public OllamaLLMAdjudicator build() {
            return new OllamaLLMAdjudicator(this);
        }
    }

    // api/generate payloads
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream,
            String format
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
