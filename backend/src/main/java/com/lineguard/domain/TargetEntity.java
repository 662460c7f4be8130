package com.lineguard.domain;

public enum TargetEntity {
    PRICE_BAND,
    CANONICAL_ITEM,
    ITEM_SYNONYM,
    AGENT_RULE_SCOPE
}
