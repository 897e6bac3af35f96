package ai.foundrystack.backend.service;

import ai.foundrystack.backend.service.exception.ModelClientException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * ModelClient backed by the Gemini generateContent REST endpoint.
 *
 * Error bodies returned by the provider are logged but never put into exception messages,
 * since those messages end up in job records.
 */
@Slf4j
@Service
public class GeminiModelClient implements ModelClient {

    private static final String PROVIDER_NAME = "gemini";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String modelName;
    private final String apiKey;
    private final int maxOutputTokens;

    @Autowired
    public GeminiModelClient(
            @Qualifier("model") RestTemplate restTemplate,
            @Value("${app.model.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${app.model.name:gemini-2.5-flash}") String modelName,
            @Value("${app.model.api-key:}") String apiKey,
            @Value("${app.model.max-output-tokens:4000}") int maxOutputTokens) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.modelName = modelName;
        this.apiKey = apiKey;
        this.maxOutputTokens = maxOutputTokens;
    }

    @Override
    public String complete(String prompt, double temperature) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ModelClientException("Model API key is not configured");
        }

        String url = baseUrl + "/models/" + modelName + ":generateContent?key={key}";
        GenerateContentRequest request = GenerateContentRequest.of(prompt, temperature, maxOutputTokens);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<GenerateContentRequest> entity = new HttpEntity<>(request, headers);

        try {
            log.debug("Sending prompt of {} chars to {} (temperature {})", prompt.length(), modelName, temperature);
            ResponseEntity<GenerateContentResponse> response =
                    restTemplate.postForEntity(url, entity, GenerateContentResponse.class, apiKey);

            String text = response.getBody() != null ? response.getBody().firstText() : null;
            if (text == null) {
                log.warn("Model {} returned no candidate text", modelName);
                return "";
            }
            return text;

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            log.error("Model provider returned HTTP {}: {}", status, e.getResponseBodyAsString());
            throw new ModelClientException("Model provider returned HTTP " + status, status, e);
        } catch (RestClientException e) {
            log.error("Failed to reach model provider: {}", e.getMessage());
            throw new ModelClientException("Model provider unreachable", e);
        }
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    /**
     * Request body of generateContent.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerateContentRequest {
        private List<Content> contents;
        private GenerationConfig generationConfig;

        static GenerateContentRequest of(String prompt, double temperature, int maxOutputTokens) {
            Content content = new Content(List.of(new Part(prompt)), null);
            return new GenerateContentRequest(List.of(content),
                    new GenerationConfig(temperature, maxOutputTokens, 0.95, 40));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GenerationConfig {
        private double temperature;
        private int maxOutputTokens;
        private double topP;
        private int topK;
    }

    /**
     * Response body of generateContent; only the first candidate's first text part is used.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerateContentResponse {
        private List<Candidate> candidates;

        String firstText() {
            if (candidates == null || candidates.isEmpty()) {
                return null;
            }
            Content content = candidates.get(0).getContent();
            if (content == null || content.getParts() == null || content.getParts().isEmpty()) {
                return null;
            }
            return content.getParts().get(0).getText();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Candidate {
        private Content content;
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Content {
        private List<Part> parts;
        private String role;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Part {
        private String text;
    }
}
