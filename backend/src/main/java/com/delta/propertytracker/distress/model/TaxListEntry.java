package com.delta.propertytracker.distress.model;

public record TaxListEntry(String apn, String addressGuess) {}
