package com.ai.screening.service;

import com.ai.screening.dto.ChatTurn;
import com.ai.screening.dto.GenerationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates screening replies using OpenAI Chat Completions.
 */
@Service
public class OpenAiResponseGenerator implements ResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiResponseGenerator.class);

    // gpt-4o-mini pricing, USD per 1K tokens
    static final double INPUT_COST_PER_1K = 0.00015;
    static final double OUTPUT_COST_PER_1K = 0.0006;

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final String completionsUrl;

    public OpenAiResponseGenerator(RestTemplateBuilder builder,
                                   @Value("${openai.api-key:}") String apiKey,
                                   @Value("${openai.model:gpt-4o-mini}") String model,
                                   @Value("${openai.max-tokens:500}") int maxTokens,
                                   @Value("${openai.temperature:0.7}") double temperature,
                                   @Value("${openai.timeout-seconds:3}") int timeoutSeconds,
                                   @Value("${openai.base-url:https://api.openai.com/v1}") String baseUrl) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.completionsUrl = StringUtils.removeEnd(baseUrl, "/") + "/chat/completions";
    }

    @Override
    public GenerationResult generate(String systemPrompt, List<ChatTurn> history, String newMessage) {
        if (StringUtils.isBlank(apiKey)) {
            log.error("OPENAI_API_KEY is not set");
            return GenerationResult.failure(GenerationResult.Failure.UPSTREAM_ERROR, "OpenAI API key is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt));
        if (history != null) {
            for (ChatTurn turn : history) {
                messages.add(message(turn.getRole(), turn.getContent()));
            }
        }
        messages.add(message(ChatTurn.USER, newMessage));

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("messages", messages);

        long start = System.nanoTime();
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    completionsUrl, new HttpEntity<>(body, headers), String.class);
            long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
            return parse(response.getBody(), latencyMs);
        } catch (RestClientException ex) {
            long elapsed = Duration.ofNanos(System.nanoTime() - start).toMillis();
            if (ExceptionUtils.indexOfType(ex, InterruptedIOException.class) >= 0) {
                log.error("OpenAI call timed out after {} ms", elapsed);
                return GenerationResult.failure(GenerationResult.Failure.TIMEOUT, "OpenAI request timed out");
            }
            log.error("OpenAI call failed after {} ms: {}", elapsed, ex.getMessage());
            return GenerationResult.failure(GenerationResult.Failure.UPSTREAM_ERROR, ex.getMessage());
        }
    }

    private GenerationResult parse(String responseBody, long latencyMs) {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.error("Unreadable OpenAI response: {}", ex.getMessage());
            return GenerationResult.failure(GenerationResult.Failure.UPSTREAM_ERROR, "Unreadable completion response");
        }
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            log.error("OpenAI response had no completion text");
            return GenerationResult.failure(GenerationResult.Failure.UPSTREAM_ERROR, "Empty completion response");
        }

        JsonNode usage = root.path("usage");
        Integer tokensInput = intOrNull(usage, "prompt_tokens");
        Integer tokensOutput = intOrNull(usage, "completion_tokens");
        Integer tokensTotal = intOrNull(usage, "total_tokens");
        Double costUsd = null;
        Integer costCents = null;
        if (tokensInput != null && tokensOutput != null) {
            costUsd = estimateCostUsd(tokensInput, tokensOutput);
            costCents = (int) (costUsd * 100);
        }

        log.info("OpenAI reply generated tokens={} latencyMs={} costUsd={}",
                tokensTotal, latencyMs, costUsd != null ? String.format("%.6f", costUsd) : "n/a");
        return GenerationResult.success(content.asText().trim(), tokensInput, tokensOutput, tokensTotal,
                costUsd, costCents, latencyMs);
    }

    static double estimateCostUsd(int tokensInput, int tokensOutput) {
        return tokensInput / 1000.0 * INPUT_COST_PER_1K + tokensOutput / 1000.0 * OUTPUT_COST_PER_1K;
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isNumber() ? v.asInt() : null;
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content != null ? content : "");
        return m;
    }
}
