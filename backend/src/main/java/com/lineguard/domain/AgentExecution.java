package com.lineguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One pipeline stage run. Written once, after the stage finished, so startTime and endTime are always
 * both present. executionOrder is unique and increasing within a session.
 */
@Document(collection = "agent_executions")
@CompoundIndex(name = "session_order", def = "{'sessionId': 1, 'executionOrder': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AgentExecution {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String sessionId;
    /** Null for session-level stages. */
    private Integer itemIndex;
    private PipelineStage stageName;
    private long executionOrder;
    private Instant startTime;
    private Instant endTime;
    private Map<String, Object> inputSnapshot;
    private Map<String, Object> outputSnapshot;
    private Double confidence;
    private ExecutionStatus status;
    private String errorMessage;
}
