package org.openfoodfacts.robotoff.ocr;

public record OcrFullTextAnnotation(String text, String contiguousText) {

    public static OcrFullTextAnnotation of(String text) {
        return new OcrFullTextAnnotation(text, text.replace('\n', ' '));
    }
}
