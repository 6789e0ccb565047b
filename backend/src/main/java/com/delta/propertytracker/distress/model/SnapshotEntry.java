package com.delta.propertytracker.distress.model;

public record SnapshotEntry(long runId, long itemId, String key, String hash) {}
