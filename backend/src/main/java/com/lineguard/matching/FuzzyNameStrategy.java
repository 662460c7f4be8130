package com.lineguard.matching;

import com.lineguard.common.TokenSetSimilarity;
import com.lineguard.domain.CanonicalItemRepository;
import com.lineguard.domain.MatchMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Token-set similarity against every canonical name, accepted at or above the configured threshold.
 */
@Component
@RequiredArgsConstructor
public class FuzzyNameStrategy implements CatalogMatchStrategy {

    private final CanonicalItemRepository canonicalItemRepository;
    private final MatchingProperties properties;

    @Override
    public MatchMethod method() {
        return MatchMethod.FUZZY;
    }

    @Override
    public List<MatchCandidate> findCandidates(String normalizedName) {
        return canonicalItemRepository.findAllByOrderByPopularityDesc().stream()
                .map(item -> new MatchCandidate(
                        item.getId(),
                        item.getName(),
                        TokenSetSimilarity.score(normalizedName, item.getNormalizedName()),
                        item.getPopularity(),
                        MatchMethod.FUZZY))
                .filter(c -> c.confidence() >= properties.getFuzzyThreshold())
                .map(c -> new MatchCandidate(c.canonicalItemId(), c.canonicalName(),
                        Math.min(c.confidence(), properties.getFuzzyConfidenceCap()), c.popularity(), c.method()))
                .toList();
    }
}
