package com.delta.propertytracker.distress.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    RunMeta latestRun
) {
}
