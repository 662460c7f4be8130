package com.lineguard.domain;

public enum RuleDecision {
    ALLOW,
    DENY
}
