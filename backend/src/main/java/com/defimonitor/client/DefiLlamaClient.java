package com.defimonitor.client;

import com.defimonitor.config.AppProps;
import com.defimonitor.exception.RetryableFetchException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Blocking client for the DefiLlama TVL endpoint: GET {baseUrl}/tvl/{slug}.
 * Accepts a bare number or an object with a "tvl" field.
 * Server errors and timeouts are retried with linear backoff; client errors and bad bodies are not.
 */
@Component
@Slf4j
public class DefiLlamaClient {

    private final RestTemplate defiLlamaRestTemplate;
    private final AppProps.DefiLlama cfg;

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public DefiLlamaClient(@Qualifier("defiLlamaRestTemplate") RestTemplate defiLlamaRestTemplate, AppProps props) {
        this.defiLlamaRestTemplate = defiLlamaRestTemplate;
        this.cfg = props.getDefillama();
    }

    /**
     * @return current TVL in USD, or empty when the protocol could not be fetched after all attempts
     */
    public Optional<BigDecimal> fetchTvl(String slug) {
        Assert.hasText(slug, "slug required");
        URI uri = UriComponentsBuilder.fromHttpUrl(cfg.getBaseUrl())
                .path("/tvl/{slug}")
                .buildAndExpand(slug)
                .toUri();

        int maxRetries = Math.max(1, cfg.getMaxRetries());
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            log.info("Fetching {} (attempt {}/{})", uri, attempt, maxRetries);
            try {
                Optional<BigDecimal> tvl = decode(get(uri));
                if (tvl.isEmpty()) {
                    log.warn("Could not extract TVL for {}", slug);
                }
                return tvl;
            } catch (RetryableFetchException ex) {
                log.warn("[defillama] {} for {}", ex.getMessage(), uri);
                if (attempt < maxRetries && !backoff(cfg.getRetryDelay().multipliedBy(attempt))) {
                    return Optional.empty();
                }
            } catch (RestClientException ex) {
                log.error("[defillama] request error fetching {}: {}", uri, ex.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private String get(URI uri) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Void> req = new HttpEntity<>(headers);
        try {
            ResponseEntity<String> resp = defiLlamaRestTemplate.exchange(uri, HttpMethod.GET, req, String.class);
            return resp.getBody();
        } catch (HttpServerErrorException e) {
            throw new RetryableFetchException("Server error " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new RetryableFetchException("Timeout or I/O error: " + e.getMessage(), e);
        } catch (HttpClientErrorException e) {
            throw new RestClientException("DefiLlama HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        }
    }

    /** Bare number root, or {"tvl": number}. Anything else yields empty. */
    private Optional<BigDecimal> decode(String json) {
        if (json == null || json.isBlank()) return Optional.empty();
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || root.isNull()) return Optional.empty();
            if (root.isNumber()) return Optional.of(root.decimalValue());
            JsonNode tvl = root.get("tvl");
            if (tvl != null && tvl.isNumber()) return Optional.of(tvl.decimalValue());
            return Optional.empty();
        } catch (Exception e) {
            log.error("[defillama] malformed response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean backoff(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ignore) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
