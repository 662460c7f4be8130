package com.lineguard.proposal;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Proposal handling. Documented in application.yml under lineguard.proposals.
 */
@ConfigurationProperties(prefix = "lineguard.proposals")
@Getter
@Setter
public class ProposalProperties {

    /**
     * When true, approving a proposal records the decision but leaves catalog data untouched.
     */
    private boolean dryRun = true;
}
