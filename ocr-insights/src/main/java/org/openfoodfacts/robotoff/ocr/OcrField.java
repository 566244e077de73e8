package org.openfoodfacts.robotoff.ocr;

public enum OcrField {
    FULL_TEXT,
    FULL_TEXT_CONTIGUOUS,
    TEXT_ANNOTATIONS
}
