package ai.foundrystack.backend.service;

import ai.foundrystack.backend.service.exception.DownstreamServiceException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

import java.util.Map;

/**
 * Client for the downstream retriever agent service, which enriches a startup idea with
 * market and technology context before the blueprint chain runs.
 */
@Service
public class DownstreamAgentClient {

    private static final Logger logger = LoggerFactory.getLogger(DownstreamAgentClient.class);
    private static final String RETRIEVER = "retriever";

    private final RestTemplate restTemplate;
    private final String retrieverUrl;
    private final boolean retrieverEnabled;

    @Autowired
    public DownstreamAgentClient(
            @Qualifier("internal") RestTemplate restTemplate,
            @Value("${agent.retriever.url:http://localhost:8000}") String retrieverUrl,
            @Value("${agent.retriever.enabled:false}") boolean retrieverEnabled) {
        this.restTemplate = restTemplate;
        this.retrieverUrl = retrieverUrl;
        this.retrieverEnabled = retrieverEnabled;
    }

    /**
     * Sends the query to the retriever's enrich endpoint.
     *
     * @param query the raw idea text
     * @return the enrichment returned by the retriever
     * @throws DownstreamServiceException on a non-2xx answer or when the service cannot be reached
     */
    public EnrichmentResponse enrichQuery(String query) {
        String url = retrieverUrl + "/enrich";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EnrichRequest> entity = new HttpEntity<>(new EnrichRequest(query), headers);

        try {
            logger.debug("Sending query to retriever at: {}", url);
            ResponseEntity<EnrichmentResponse> response = restTemplate.postForEntity(url, entity, EnrichmentResponse.class);

            if (response.getBody() == null) {
                throw new DownstreamServiceException(RETRIEVER, response.getStatusCode().value(), null);
            }
            logger.debug("Retriever enriched query in {}s", response.getBody().getProcessingTime());
            return response.getBody();

        } catch (HttpStatusCodeException e) {
            logger.error("Retriever returned HTTP {}: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new DownstreamServiceException(RETRIEVER, e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RestClientException e) {
            logger.error("Failed to communicate with retriever: {}", e.getMessage());
            throw new DownstreamServiceException(RETRIEVER, e.getMessage(), e);
        }
    }

    public boolean isRetrieverEnabled() {
        return retrieverEnabled;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnrichRequest {
        private String query;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnrichmentResponse {
        private boolean success;

        @JsonProperty("original_query")
        private String originalQuery;

        @JsonProperty("enriched_query")
        private String enrichedQuery;

        private Map<String, Object> context;

        private Map<String, Object> analysis;

        private Double confidence;

        @JsonProperty("processing_time")
        private Double processingTime;
    }
}
