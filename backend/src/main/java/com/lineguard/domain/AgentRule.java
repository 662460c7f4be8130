package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Operator rule forcing a decision for everything in a scope (item, category or vendor).
 */
@Document(collection = "agent_rules")
@CompoundIndex(name = "active_scope", def = "{'active': 1, 'scopeType': 1, 'scopeValue': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AgentRule {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private RuleScope scopeType;
    private String scopeValue;
    private RuleDecision decision;
    private String reason;
    private boolean active;
    private Instant createdAt;

    public String scopeKey() {
        return scopeType + ":" + scopeValue;
    }
}
