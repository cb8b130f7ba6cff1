package junie.email.intel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import junie.email.intel.model.AiAnalysisRequest;
import junie.email.intel.model.AiAnalysisResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Google Gemini over its REST generateContent endpoint.
 */
@Slf4j
public class GeminiAnalysisClient implements AiAnalysisClient {
    private static final String GEMINI_API_URL = "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public GeminiAnalysisClient(String apiKey) {
        this(new RestTemplate(), new ObjectMapper(), apiKey);
    }

    public GeminiAnalysisClient(RestTemplate restTemplate, ObjectMapper objectMapper, String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;

        if (!isConfigured()) {
            log.warn("Gemini API key not configured. Set gemini.api.key in application.properties or environment variable.");
        }
    }

    @Override
    public AiAnalysisResponse analyze(AiAnalysisRequest request) {
        if (!isConfigured()) {
            throw new QuotaException("Gemini API key not configured", new IllegalStateException("Missing API key"));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> requestBody = new HashMap<>();
        Map<String, Object> part = new HashMap<>();
        part.put("text", OpenAiAnalysisClient.SYSTEM_PROMPT + "\n\n" + request.getPrompt());
        requestBody.put("contents", List.of(Map.of("parts", List.of(part))));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("maxOutputTokens", request.getMaxTokens());
        generationConfig.put("temperature", 0.2);
        generationConfig.put("responseMimeType", "application/json");
        requestBody.put("generationConfig", generationConfig);

        String url = String.format(GEMINI_API_URL, request.getModelHint()) + "?key=" + apiKey;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(requestBody, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new IllegalStateException("Gemini API error: " + response.getStatusCode() + " - " + response.getBody());
            }
            return parse(response.getBody(), request.getModelHint());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                    || e.getResponseBodyAsString().toLowerCase(Locale.ROOT).contains("resource_exhausted")) {
                throw new QuotaException("Gemini quota/rate limit exceeded for " + request.getModelHint() + ": " + e.getMessage(), e);
            }
            throw e;
        }
    }

    @Override
    public String providerName() {
        return "gemini";
    }

    private AiAnalysisResponse parse(String body, String model) {
        try {
            JsonNode json = objectMapper.readTree(body);
            JsonNode parts = json.path("candidates").path(0).path("content").path("parts");
            if (!parts.isArray() || parts.size() == 0) {
                throw new IllegalStateException("Unexpected Gemini API response format: " + body);
            }
            JsonNode usage = json.path("usageMetadata");
            return AiAnalysisResponse.builder()
                    .content(parts.get(0).path("text").asText("").trim())
                    .model(model)
                    .promptTokens(usage.path("promptTokenCount").asLong(0))
                    .completionTokens(usage.path("candidatesTokenCount").asLong(0))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Gemini returned invalid JSON", e);
        }
    }

    private boolean isConfigured() {
        return apiKey != null && !apiKey.isEmpty() && !apiKey.startsWith("${");
    }
}
