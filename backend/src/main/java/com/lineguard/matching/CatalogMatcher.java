package com.lineguard.matching;

import com.lineguard.common.OrderedBatch;
import com.lineguard.common.TextNormalizer;
import com.lineguard.config.AsyncConfig;
import com.lineguard.config.CaffeineConfig;
import com.lineguard.domain.MatchMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Resolves free-text item names to canonical catalog entries.
 * Strategies run in the configured order and the first one with candidates decides; among its candidates
 * the highest confidence wins, then the higher popularity, then the smaller canonical id.
 * Results are cached per normalized (name, description); forceMatcher recomputes and refreshes the entry.
 */
@Service
@Slf4j
public class CatalogMatcher {

    public static final String INVALID_INPUT = "INVALID_INPUT";

    static final Comparator<MatchCandidate> BEST_FIRST = Comparator
            .comparingDouble(MatchCandidate::confidence).reversed()
            .thenComparing(Comparator.comparingLong(MatchCandidate::popularity).reversed())
            .thenComparing(MatchCandidate::canonicalItemId);

    private final Map<MatchMethod, CatalogMatchStrategy> strategies = new EnumMap<>(MatchMethod.class);
    private final MatchingProperties properties;
    private final Cache matchCache;
    private final Executor pipelineExecutor;

    public CatalogMatcher(List<CatalogMatchStrategy> strategyBeans,
                          MatchingProperties properties,
                          CacheManager cacheManager,
                          @Qualifier(AsyncConfig.PIPELINE_EXECUTOR) Executor pipelineExecutor) {
        strategyBeans.forEach(s -> strategies.put(s.method(), s));
        this.properties = properties;
        this.matchCache = Objects.requireNonNull(cacheManager.getCache(CaffeineConfig.MATCH_RESULT_CACHE),
                "cache " + CaffeineConfig.MATCH_RESULT_CACHE + " not registered");
        this.pipelineExecutor = pipelineExecutor;
    }

    public MatchResult match(String itemName, String description) {
        return match(itemName, description, false);
    }

    /**
     * @throws MatchingException INVALID_INPUT when itemName is blank after normalization
     */
    public MatchResult match(String itemName, String description, boolean forceMatcher) {
        String normalizedName = TextNormalizer.normalize(itemName);
        if (normalizedName.isEmpty()) {
            throw new MatchingException(INVALID_INPUT, "itemName is required");
        }
        String normalizedDescription = TextNormalizer.normalize(description);
        String key = normalizedName + "|" + normalizedDescription;
        if (!forceMatcher) {
            MatchResult cached = matchCache.get(key, MatchResult.class);
            if (cached != null) {
                return cached;
            }
        }
        MatchResult result = resolve(normalizedName, normalizedDescription);
        matchCache.put(key, result);
        log.debug("Matched '{}' -> {} ({}, {})", normalizedName, result.canonicalItemId(), result.method(), result.confidence());
        return result;
    }

    /**
     * Matches each query independently on the pipeline executor. Results keep input order; a query with bad
     * input is reported as blocked without affecting the others.
     */
    public MatchBatchResult matchBatch(List<MatchQuery> queries) {
        long start = System.currentTimeMillis();
        List<MatchOutcome> outcomes = OrderedBatch.mapInOrder(
                queries,
                q -> MatchOutcome.of(match(q.itemName(), q.itemDescription(), q.forceMatcher()).withLineItemId(q.lineItemId())),
                (q, ex) -> blocked(q, ex),
                pipelineExecutor);
        return MatchBatchResult.of(outcomes, System.currentTimeMillis() - start);
    }

    private MatchResult resolve(String normalizedName, String normalizedDescription) {
        for (MatchMethod method : properties.getStrategies()) {
            CatalogMatchStrategy strategy = strategies.get(method);
            if (strategy == null) {
                continue;
            }
            List<MatchCandidate> candidates = strategy.findCandidates(normalizedName);
            if (candidates.isEmpty() && method == MatchMethod.FUZZY && !normalizedDescription.isEmpty()) {
                candidates = strategy.findCandidates(normalizedName + " " + normalizedDescription);
            }
            if (!candidates.isEmpty()) {
                return MatchResult.of(candidates.stream().sorted(BEST_FIRST).findFirst().orElseThrow());
            }
        }
        return MatchResult.miss(null);
    }

    private static MatchOutcome blocked(MatchQuery query, Throwable ex) {
        if (ex instanceof MatchingException me) {
            return MatchOutcome.blocked(query.lineItemId(), me.getErrorCode(), me.getMessage());
        }
        log.warn("Match failed for line item {}: {}", query.lineItemId(), ex.getMessage());
        return MatchOutcome.blocked(query.lineItemId(), "MATCH_FAILED", "Matching failed: " + ex.getMessage());
    }
}
