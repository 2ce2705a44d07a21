package com.toolfinder.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the embedding model: {@code POST {baseUrl}/v1/embed}.
 */
@Component
public class EmbeddingGateway implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EmbedRequest> entity = new HttpEntity<>(new EmbedRequest(properties.getModel(), List.of(text)), headers);
        String url = endpoint();
        RestTemplate client = clientFor(timeBudgetMs);

        int attempts = Math.max(0, properties.getRetryCount()) + 1;
        EmbeddingUnavailableException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                ResponseEntity<EmbedResponse> response = client.postForEntity(url, entity, EmbedResponse.class);
                return firstVector(response.getBody());
            } catch (ResourceAccessException e) {
                String reason = e.getCause() instanceof SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
                lastFailure = new EmbeddingUnavailableException(reason, e);
            } catch (HttpStatusCodeException e) {
                lastFailure = new EmbeddingUnavailableException("embed_http_" + e.getStatusCode().value(), e);
                if (e.getStatusCode().is4xxClientError()) {
                    break;
                }
            }
            log.debug("embed attempt failed attempt={} of={} reason={}", attempt, attempts, lastFailure.getMessage());
        }
        throw lastFailure;
    }

    private List<Double> firstVector(EmbedResponse body) {
        if (body == null || body.getVectors() == null || body.getVectors().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> vector = body.getVectors().get(0);
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        return vector;
    }

    private String endpoint() {
        String base = properties.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/v1/embed";
    }

    private RestTemplate clientFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null || timeBudgetMs <= 0 || timeBudgetMs >= properties.getTimeoutMs()) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeBudgetMs);
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbedRequest {
        private String model;
        private List<String> texts;
        private boolean normalize = true;

        public EmbedRequest() {
        }

        public EmbedRequest(String model, List<String> texts) {
            this.model = model;
            this.texts = texts;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getTexts() {
            return texts;
        }

        public void setTexts(List<String> texts) {
            this.texts = texts;
        }

        public boolean isNormalize() {
            return normalize;
        }

        public void setNormalize(boolean normalize) {
            this.normalize = normalize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbedResponse {
        private String model;
        private List<List<Double>> vectors;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<List<Double>> getVectors() {
            return vectors;
        }

        public void setVectors(List<List<Double>> vectors) {
            this.vectors = vectors;
        }
    }
}
