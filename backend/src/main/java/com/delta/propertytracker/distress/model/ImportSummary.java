package com.delta.propertytracker.distress.model;

import java.util.Map;

public record ImportSummary(int inserted, Map<Stage, Integer> stageCounts) {}
