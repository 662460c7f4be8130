package com.lineguard.domain;

public enum RuleScope {
    ITEM,
    CATEGORY,
    VENDOR
}
