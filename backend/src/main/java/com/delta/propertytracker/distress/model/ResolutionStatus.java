package com.delta.propertytracker.distress.model;

public enum ResolutionStatus {
    UNATTEMPTED,
    UNRESOLVED,
    RESOLVED
}
