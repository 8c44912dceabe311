package com.postcraft.domain.generation.model;

public enum BusinessType {
    RESTAURANT,
    RETAIL,
    FINANCE,
    TECHNOLOGY,
    HEALTH,
    BEAUTY,
    FITNESS,
    EDUCATION,
    REAL_ESTATE,
    PROFESSIONAL_SERVICES,
    OTHER
}
