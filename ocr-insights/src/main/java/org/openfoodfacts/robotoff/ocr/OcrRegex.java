package org.openfoodfacts.robotoff.ocr;

import lombok.Builder;

import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * A pattern and the OCR text it is applied to.
 *
 * @param processor turns a match into the insight value, {@code null} when the match itself is not used
 */
@Builder
public record OcrRegex(Pattern pattern,
                       OcrField field,
                       boolean lowercase,
                       Function<MatchResult, String> processor) {
}
