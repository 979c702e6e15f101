package com.microsoft.costanalytics.domain.model;

public enum RecommendationPriority {
    LOW,
    MEDIUM,
    HIGH
}
