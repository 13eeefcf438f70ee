package com.example.emotion.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StressLevel {
    LOW("low"),
    MODERATE("moderate"),
    ELEVATED("elevated");

    private final String label;

    StressLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * 低于 moderateBand 为 low，低于 elevatedBand 为 moderate，否则 elevated
     */
    public static StressLevel of(double stressScore, double moderateBand, double elevatedBand) {
        if (stressScore < moderateBand) {
            return LOW;
        }
        return stressScore < elevatedBand ? MODERATE : ELEVATED;
    }
}
