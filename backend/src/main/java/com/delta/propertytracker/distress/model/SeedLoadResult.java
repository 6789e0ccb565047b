package com.delta.propertytracker.distress.model;

public record SeedLoadResult(boolean loaded, int inserted, String message) {}
