package com.lineguard.domain;

/**
 * Kind of catalog change a proposal asks a human to approve.
 */
public enum ProposalType {
    /** Create or replace the price band of a canonical item. */
    PRICE_RANGE_ADJUST,
    /** Create the canonical item an orphan synonym points at. */
    NEW_CANONICAL,
    REMOVE_SYNONYM,
    /** Keep one rule in a scope and deactivate the contradicting ones. */
    RULE_CONSOLIDATION
}
