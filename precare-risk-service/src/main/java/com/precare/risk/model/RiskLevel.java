package com.precare.risk.model;

public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH
}
