package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentRuleRepository extends MongoRepository<AgentRule, String> {

    List<AgentRule> findByActiveTrue();

    List<AgentRule> findByActiveTrueAndScopeTypeAndScopeValueOrderByCreatedAtDesc(RuleScope scopeType, String scopeValue);
}
