package com.lineguard.matching;

import com.lineguard.config.CaffeineConfig;
import com.lineguard.domain.LineItemStatus;
import com.lineguard.domain.MatchMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.caffeine.CaffeineCacheManager;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogMatcherTest {

    @Mock
    CatalogMatchStrategy exact;
    @Mock
    CatalogMatchStrategy synonym;
    @Mock
    CatalogMatchStrategy fuzzy;

    CatalogMatcher matcher;

    @BeforeEach
    void setUp() {
        when(exact.method()).thenReturn(MatchMethod.EXACT);
        when(synonym.method()).thenReturn(MatchMethod.SYNONYM);
        when(fuzzy.method()).thenReturn(MatchMethod.FUZZY);
        matcher = new CatalogMatcher(List.of(fuzzy, synonym, exact), new MatchingProperties(),
                new CaffeineCacheManager(CaffeineConfig.MATCH_RESULT_CACHE), Runnable::run);
    }

    private static MatchCandidate candidate(String id, double confidence, long popularity, MatchMethod method) {
        return new MatchCandidate(id, "Item " + id, confidence, popularity, method);
    }

    @Test
    @DisplayName("exact hit wins and later strategies are not consulted")
    void exactFirst() {
        when(exact.findCandidates("pvc pipe")).thenReturn(List.of(candidate("c1", 0.98, 5, MatchMethod.EXACT)));

        MatchResult result = matcher.match("PVC Pipe", null);

        assertThat(result.canonicalItemId()).isEqualTo("c1");
        assertThat(result.method()).isEqualTo(MatchMethod.EXACT);
        assertThat(result.confidence()).isEqualTo(0.98);
        verify(synonym, never()).findCandidates(anyString());
        verify(fuzzy, never()).findCandidates(anyString());
    }

    @Test
    @DisplayName("falls through to the synonym strategy when exact has no candidate")
    void synonymFallback() {
        when(exact.findCandidates("pvc tube")).thenReturn(List.of());
        when(synonym.findCandidates("pvc tube")).thenReturn(List.of(candidate("c1", 0.9, 5, MatchMethod.SYNONYM)));

        MatchResult result = matcher.match("pvc tube", "");

        assertThat(result.canonicalItemId()).isEqualTo("c1");
        assertThat(result.method()).isEqualTo(MatchMethod.SYNONYM);
    }

    @Test
    @DisplayName("equal confidence is broken by popularity, then by id")
    void tieBreak() {
        when(exact.findCandidates("pipe")).thenReturn(List.of(
                candidate("c3", 0.9, 10, MatchMethod.EXACT),
                candidate("c2", 0.9, 50, MatchMethod.EXACT),
                candidate("c1", 0.9, 50, MatchMethod.EXACT),
                candidate("c0", 0.8, 99, MatchMethod.EXACT)));

        assertThat(matcher.match("pipe", null).canonicalItemId()).isEqualTo("c1");
    }

    @Test
    @DisplayName("matching is idempotent and the second call is served from cache")
    void idempotentAndCached() {
        when(exact.findCandidates("pvc pipe")).thenReturn(List.of(candidate("c1", 0.98, 5, MatchMethod.EXACT)));

        MatchResult first = matcher.match("PVC Pipe", null);
        MatchResult second = matcher.match("  pvc   PIPE ", null);

        assertThat(second.canonicalItemId()).isEqualTo(first.canonicalItemId());
        assertThat(second.confidence()).isEqualTo(first.confidence());
        verify(exact, times(1)).findCandidates("pvc pipe");
    }

    @Test
    @DisplayName("forceMatcher bypasses the cache")
    void forceMatcherBypassesCache() {
        when(exact.findCandidates("pvc pipe")).thenReturn(List.of(candidate("c1", 0.98, 5, MatchMethod.EXACT)));

        matcher.match("pvc pipe", null);
        matcher.match("pvc pipe", null, true);

        verify(exact, times(2)).findCandidates("pvc pipe");
    }

    @Test
    @DisplayName("no candidate from any strategy is a miss, not an error")
    void miss() {
        when(exact.findCandidates("xsaxa")).thenReturn(List.of());
        when(synonym.findCandidates("xsaxa")).thenReturn(List.of());
        when(fuzzy.findCandidates("xsaxa")).thenReturn(List.of());

        MatchResult result = matcher.match("xsaxa", null);

        assertThat(result.isMatch()).isFalse();
        assertThat(result.method()).isEqualTo(MatchMethod.NONE);
        assertThat(MatchOutcome.of(result).status()).isEqualTo(LineItemStatus.AWAITING_INGEST);
    }

    @Test
    @DisplayName("fuzzy retries with name and description when the name alone misses")
    void fuzzyUsesDescription() {
        when(exact.findCandidates("widget")).thenReturn(List.of());
        when(synonym.findCandidates("widget")).thenReturn(List.of());
        when(fuzzy.findCandidates("widget")).thenReturn(List.of());
        when(fuzzy.findCandidates("widget copper elbow")).thenReturn(List.of(candidate("c9", 0.9, 1, MatchMethod.FUZZY)));

        assertThat(matcher.match("Widget", "Copper elbow").canonicalItemId()).isEqualTo("c9");
    }

    @Test
    @DisplayName("blank item name is rejected with INVALID_INPUT")
    void blankName() {
        assertThatThrownBy(() -> matcher.match("  ", null))
                .isInstanceOf(MatchingException.class)
                .satisfies(e -> assertThat(((MatchingException) e).getErrorCode()).isEqualTo(CatalogMatcher.INVALID_INPUT));
    }

    @Test
    @DisplayName("batch keeps input order and counts matched, missed and blocked")
    void batch() {
        when(exact.findCandidates("pvc pipe")).thenReturn(List.of(candidate("c1", 0.98, 5, MatchMethod.EXACT)));
        when(exact.findCandidates("xsaxa")).thenReturn(List.of());
        when(synonym.findCandidates("xsaxa")).thenReturn(List.of());
        when(fuzzy.findCandidates("xsaxa")).thenReturn(List.of());

        MatchBatchResult batch = matcher.matchBatch(List.of(
                new MatchQuery("l1", "xsaxa", null, false),
                new MatchQuery("l2", "", null, false),
                new MatchQuery("l3", "PVC Pipe", null, false)));

        assertThat(batch.results()).extracting(MatchOutcome::lineItemId).containsExactly("l1", "l2", "l3");
        assertThat(batch.results().get(0).status()).isEqualTo(LineItemStatus.AWAITING_INGEST);
        assertThat(batch.results().get(1).success()).isFalse();
        assertThat(batch.results().get(1).errorCode()).isEqualTo(CatalogMatcher.INVALID_INPUT);
        assertThat(batch.results().get(2).status()).isEqualTo(LineItemStatus.MATCHED);
        assertThat(batch.results().get(2).matchResult().lineItemId()).isEqualTo("l3");
        assertThat(batch.success()).isFalse();
        assertThat(batch.summary().total()).isEqualTo(3);
        assertThat(batch.summary().matched()).isEqualTo(1);
        assertThat(batch.summary().missed()).isEqualTo(1);
        assertThat(batch.summary().blocked()).isEqualTo(1);
    }
}
