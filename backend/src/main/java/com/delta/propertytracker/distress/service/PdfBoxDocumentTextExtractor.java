package com.delta.propertytracker.distress.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;

@Service
public class PdfBoxDocumentTextExtractor implements DocumentTextExtractor {
    @Override
    public String extractText(byte[] document) throws IOException {
        if (document == null || document.length == 0) {
            throw new IOException("document is empty");
        }
        try (PDDocument pdf = PDDocument.load(document)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(pdf);
        }
    }
}
