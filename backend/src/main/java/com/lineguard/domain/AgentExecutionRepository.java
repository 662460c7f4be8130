package com.lineguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AgentExecutionRepository extends MongoRepository<AgentExecution, String> {

    List<AgentExecution> findBySessionIdOrderByExecutionOrderAsc(String sessionId);
}
