package com.delta.propertytracker.distress.model;

import java.time.Instant;

public record RunMeta(long runId, Instant createdAt) {}
