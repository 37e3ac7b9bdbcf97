package com.loadspec.model.backend;

public enum ResponseFormat {
    JSON, TEXT
}
