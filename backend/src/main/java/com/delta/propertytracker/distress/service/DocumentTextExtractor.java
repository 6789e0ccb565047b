package com.delta.propertytracker.distress.service;

import java.io.IOException;

public interface DocumentTextExtractor {
    String extractText(byte[] document) throws IOException;
}
