package com.delta.propertytracker.distress.model;

public record NewPropertyRecord(
    Stage stage,
    String apn,
    String address,
    String city,
    String state,
    String zip,
    String recordDate,
    String docType,
    String sourceUrl
) {
}
