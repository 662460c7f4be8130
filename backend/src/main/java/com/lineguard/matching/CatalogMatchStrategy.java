package com.lineguard.matching;

import com.lineguard.domain.MatchMethod;

import java.util.List;

/**
 * One way of resolving a normalized name to catalog entries. Implementations are selected by
 * {@link #method()}, never by type.
 */
public interface CatalogMatchStrategy {

    MatchMethod method();

    /**
     * @param normalizedName output of TextNormalizer.normalize, never blank
     */
    List<MatchCandidate> findCandidates(String normalizedName);
}
