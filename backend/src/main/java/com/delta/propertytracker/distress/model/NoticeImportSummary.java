package com.delta.propertytracker.distress.model;

public record NoticeImportSummary(int received, int inserted, int alreadyKnown, int skipped, int addressesGuessed) {}
