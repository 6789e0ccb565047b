package com.delta.propertytracker.distress.model;

import java.time.Instant;

public record SnapshotResult(long runId, Instant createdAt, int entryCount) {}
