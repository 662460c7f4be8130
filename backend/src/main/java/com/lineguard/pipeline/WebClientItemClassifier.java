package com.lineguard.pipeline;

import com.lineguard.common.TextNormalizer;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Classification over HTTP. Successful scores are cached per normalized item name and served as the
 * fallback when the service times out, errors or the local rate limit is exhausted.
 */
@Slf4j
public class WebClientItemClassifier implements ItemClassifier {

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final Duration timeout;
    private final Cache scoreCache;

    public WebClientItemClassifier(WebClient webClient, RateLimiter rateLimiter, Duration timeout, Cache scoreCache) {
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
        this.timeout = timeout;
        this.scoreCache = scoreCache;
    }

    @Override
    public ClassificationScore classify(LineItem item) {
        String key = TextNormalizer.normalize(item.name());
        if (!rateLimiter.acquirePermission()) {
            log.warn("Classifier rate limit reached; using fallback for '{}'", key);
            return fallback(key, "rate_limited");
        }
        try {
            ClassifierResponse response = webClient.post()
                    .uri("/classify")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new ClassifierRequest(item.name(), item.description(), item.type() != null ? item.type().name() : null))
                    .retrieve()
                    .bodyToMono(ClassifierResponse.class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.score() == null) {
                log.warn("Classifier returned no score for '{}'", key);
                return fallback(key, "empty_response");
            }
            ClassificationScore score = ClassificationScore.of(response.score(), "classifier");
            scoreCache.put(key, score.score());
            return score;
        } catch (WebClientResponseException e) {
            log.warn("Classifier HTTP {} for '{}'", e.getStatusCode().value(), key);
            return fallback(key, "http_error");
        } catch (RuntimeException e) {
            log.warn("Classifier call failed for '{}': {}", key, e.toString());
            return fallback(key, "timeout_or_error");
        }
    }

    private ClassificationScore fallback(String key, String reason) {
        Double cached = scoreCache.get(key, Double.class);
        return cached != null ? ClassificationScore.of(cached, "cache") : ClassificationScore.unavailable(reason);
    }

    record ClassifierRequest(String name, String description, String type) {
    }

    record ClassifierResponse(Double score, String label) {
    }
}
