package org.openfoodfacts.robotoff.ocr;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One Google Cloud Vision annotation response: the detected words and, when present, the whole page text.
 */
public class OcrResult {

    private final List<OcrTextAnnotation> textAnnotations;

    private final OcrFullTextAnnotation fullTextAnnotation;

    public OcrResult(List<OcrTextAnnotation> textAnnotations, OcrFullTextAnnotation fullTextAnnotation) {
        this.textAnnotations = List.copyOf(textAnnotations);
        this.fullTextAnnotation = fullTextAnnotation;
    }

    public static OcrResult fromJson(JsonNode response) {
        List<OcrTextAnnotation> textAnnotations = new ArrayList<>();
        for (JsonNode textAnnotation : response.path("textAnnotations")) {
            textAnnotations.add(OcrTextAnnotation.fromJson(textAnnotation));
        }

        JsonNode fullTextData = response.get("fullTextAnnotation");
        OcrFullTextAnnotation fullTextAnnotation = null;
        if (fullTextData != null && fullTextData.hasNonNull("text")) {
            fullTextAnnotation = OcrFullTextAnnotation.of(fullTextData.get("text").asText());
        }
        return new OcrResult(textAnnotations, fullTextAnnotation);
    }

    public List<OcrTextAnnotation> getTextAnnotations() {
        return textAnnotations;
    }

    public Optional<String> getFullText(boolean lowercase) {
        return Optional.ofNullable(fullTextAnnotation)
                .map(OcrFullTextAnnotation::text)
                .map(text -> lowercase ? text.toLowerCase(Locale.ROOT) : text);
    }

    public Optional<String> getFullTextContiguous(boolean lowercase) {
        return Optional.ofNullable(fullTextAnnotation)
                .map(OcrFullTextAnnotation::contiguousText)
                .map(text -> lowercase ? text.toLowerCase(Locale.ROOT) : text);
    }

    public List<String> getTextAnnotationTexts(boolean lowercase) {
        return textAnnotations.stream()
                .map(OcrTextAnnotation::text)
                .map(text -> lowercase ? text.toLowerCase(Locale.ROOT) : text)
                .toList();
    }

    /**
     * @return the texts the regex must be applied to, empty when the field is absent from the response
     */
    public List<String> getText(OcrRegex ocrRegex) {
        return switch (ocrRegex.field()) {
            case FULL_TEXT -> getFullText(ocrRegex.lowercase()).filter(text -> !text.isEmpty()).stream().toList();
            case FULL_TEXT_CONTIGUOUS -> getFullTextContiguous(ocrRegex.lowercase()).filter(text -> !text.isEmpty()).stream().toList();
            case TEXT_ANNOTATIONS -> getTextAnnotationTexts(ocrRegex.lowercase());
        };
    }
}
