package com.loadspec.model.parse;

public enum IssueSeverity {
    HIGH,
    MEDIUM,
    LOW
}
