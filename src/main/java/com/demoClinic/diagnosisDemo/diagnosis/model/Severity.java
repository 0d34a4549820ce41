package com.demoClinic.diagnosisDemo.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity tier shown on the dashboard for an analysis.
 */
public enum Severity {

    NORMAL("normal"),
    MILD("mild"),
    MODERATE("moderate"),
    SEVERE("severe");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
