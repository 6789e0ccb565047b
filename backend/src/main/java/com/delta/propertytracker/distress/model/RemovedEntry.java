package com.delta.propertytracker.distress.model;

public record RemovedEntry(long itemId, String key) {}
