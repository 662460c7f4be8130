package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Suggested catalog correction. Only an explicit human approval changes its status; catalog data changes
 * only when an approved proposal is applied. dedupKey makes creation idempotent per
 * (targetEntity, targetId, anomalyClass).
 */
@Document(collection = "proposals")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Proposal {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Version
    private Long version;
    @Indexed(unique = true)
    private String dedupKey;
    private AnomalyClass anomalyClass;
    private ProposalType type;
    private TargetEntity targetEntity;
    private String targetId;
    private ProposedChange proposedChange;
    private String reason;
    @Indexed
    private ProposalStatus status;
    /** Session that triggered the proposal, if any. Not owned by it. */
    private String sessionId;
    private Instant createdAt;
    private Instant decidedAt;
    private String decisionNote;
    private boolean applied;
    private Instant appliedAt;

    public static String dedupKey(TargetEntity targetEntity, String targetId, AnomalyClass anomalyClass) {
        return targetEntity + ":" + targetId + ":" + anomalyClass;
    }

    /**
     * Machine-readable change. Which fields are set depends on the proposal type.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class ProposedChange {
        private String canonicalItemId;
        private String canonicalName;
        private String currency;
        private BigDecimal currentMin;
        private BigDecimal currentMax;
        private BigDecimal suggestedMin;
        private BigDecimal suggestedMax;
        private Long usageCount;
        private String synonymId;
        private String scopeKey;
        private List<String> ruleIds;
        private String keepRuleId;
    }
}
