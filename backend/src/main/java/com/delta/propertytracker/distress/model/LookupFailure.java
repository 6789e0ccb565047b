package com.delta.propertytracker.distress.model;

public enum LookupFailure {
    INVALID_PARCEL,
    TIMEOUT,
    IO_ERROR,
    HTTP_STATUS,
    EMPTY_BODY,
    INTERRUPTED
}
