package com.lineguard.matching;

import com.lineguard.domain.CanonicalItemRepository;
import com.lineguard.domain.MatchMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ExactNameStrategy implements CatalogMatchStrategy {

    private final CanonicalItemRepository canonicalItemRepository;
    private final MatchingProperties properties;

    @Override
    public MatchMethod method() {
        return MatchMethod.EXACT;
    }

    @Override
    public List<MatchCandidate> findCandidates(String normalizedName) {
        return canonicalItemRepository.findByNormalizedName(normalizedName)
                .map(item -> List.of(new MatchCandidate(item.getId(), item.getName(),
                        properties.getExactConfidence(), item.getPopularity(), MatchMethod.EXACT)))
                .orElse(List.of());
    }
}
