package com.lineguard.matching;

import com.lineguard.common.TokenSetSimilarity;
import com.lineguard.domain.CanonicalItem;
import com.lineguard.domain.CanonicalItemRepository;
import com.lineguard.domain.ItemSynonym;
import com.lineguard.domain.ItemSynonymRepository;
import com.lineguard.domain.MatchMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Synonym table lookup: identical normalized synonym first, then token-set similarity over all synonyms.
 * Confidence is similarity times the synonym's weight. Synonyms whose canonical item is gone are ignored;
 * the safety scan reports them.
 */
@Component
@RequiredArgsConstructor
public class SynonymStrategy implements CatalogMatchStrategy {

    private final ItemSynonymRepository itemSynonymRepository;
    private final CanonicalItemRepository canonicalItemRepository;
    private final MatchingProperties properties;

    @Override
    public MatchMethod method() {
        return MatchMethod.SYNONYM;
    }

    @Override
    public List<MatchCandidate> findCandidates(String normalizedName) {
        List<ScoredSynonym> scored = itemSynonymRepository.findByNormalizedSynonym(normalizedName).stream()
                .map(s -> new ScoredSynonym(s, 1.0))
                .toList();
        if (scored.isEmpty()) {
            scored = itemSynonymRepository.findAll().stream()
                    .map(s -> new ScoredSynonym(s, TokenSetSimilarity.score(normalizedName, s.getNormalizedSynonym())))
                    .filter(s -> s.similarity() >= properties.getSynonymMinSimilarity())
                    .toList();
        }
        if (scored.isEmpty()) {
            return List.of();
        }
        Set<String> ids = scored.stream().map(s -> s.synonym().getCanonicalItemId()).collect(Collectors.toSet());
        Map<String, CanonicalItem> items = new HashMap<>();
        canonicalItemRepository.findAllById(ids).forEach(item -> items.put(item.getId(), item));

        List<MatchCandidate> candidates = new ArrayList<>();
        for (ScoredSynonym s : scored) {
            CanonicalItem item = items.get(s.synonym().getCanonicalItemId());
            if (item == null) {
                continue;
            }
            double confidence = Math.min(1.0, s.similarity() * weight(s.synonym()));
            candidates.add(new MatchCandidate(item.getId(), item.getName(), confidence, item.getPopularity(), MatchMethod.SYNONYM));
        }
        return candidates;
    }

    /** Unset (0) weight counts as full weight. */
    private static double weight(ItemSynonym synonym) {
        double w = synonym.getConfidence();
        return w <= 0 ? 1.0 : Math.min(1.0, w);
    }

    private record ScoredSynonym(ItemSynonym synonym, double similarity) {
    }
}
