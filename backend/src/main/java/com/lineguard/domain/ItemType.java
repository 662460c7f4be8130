package com.lineguard.domain;

public enum ItemType {
    MATERIAL,
    EQUIPMENT,
    LABOR
}
