package com.lineguard.pipeline;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * External item classification service. Documented in application.yml under lineguard.classifier.
 */
@ConfigurationProperties(prefix = "lineguard.classifier")
@Getter
@Setter
public class ClassifierProperties {

    /**
     * Base URL of the scoring service; requests go to {baseUrl}/classify.
     */
    private String baseUrl = "http://localhost:8090";

    /**
     * Hard timeout per call; on expiry the cached score or "unavailable" is used.
     */
    private int timeoutSeconds = 30;

    /**
     * Client-side rate limit.
     */
    private int requestsPerMinute = 60;
}
