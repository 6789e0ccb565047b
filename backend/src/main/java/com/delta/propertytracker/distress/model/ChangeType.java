package com.delta.propertytracker.distress.model;

public enum ChangeType {
    NEW,
    REMOVED,
    UPDATED,
    UNCHANGED
}
