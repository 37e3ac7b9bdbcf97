package com.loadspec.model.backend;

public record ResponseMetadata(String provider, long durationMs, boolean cached) {
}
