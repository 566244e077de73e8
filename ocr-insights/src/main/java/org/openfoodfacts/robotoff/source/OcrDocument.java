package org.openfoodfacts.robotoff.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A raw OCR JSON document and where it comes from.
 *
 * @param source image path relative to the product image root, {@code null} when unknown
 */
public record OcrDocument(String source, JsonNode content) {
}
