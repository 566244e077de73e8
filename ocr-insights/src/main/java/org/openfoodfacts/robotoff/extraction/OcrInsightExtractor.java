package org.openfoodfacts.robotoff.extraction;

import org.openfoodfacts.robotoff.enums.InsightType;
import org.openfoodfacts.robotoff.ocr.OcrRegex;
import org.openfoodfacts.robotoff.ocr.OcrResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.openfoodfacts.robotoff.extraction.OcrPatterns.BEST_BEFORE_DATES;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.EMAIL;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.LABELS;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.NUTRISCORE;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.PACKAGER_CODES;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.PHONE;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.RECYCLING;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.STORAGE_INSTRUCTIONS;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.TEMPERATURE;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.WEIGHT_MENTION;
import static org.openfoodfacts.robotoff.extraction.OcrPatterns.WEIGHT_VALUE;

/**
 * Extracts insights of one type from an OCR result. Every insight is a JSON-ready map whose
 * {@code text} entry holds the matched text.
 */
@Component
public class OcrInsightExtractor {

    static final String TEXT = "text";
    static final String TYPE = "type";

    public List<Map<String, Object>> extractInsights(OcrResult ocrResult, InsightType insightType) {
        return switch (insightType) {
            case PACKAGER_CODE -> findPackagerCodes(ocrResult);
            case LABEL -> findLabels(ocrResult);
            case NUTRISCORE -> onFullText(ocrResult, text -> findMatches(NUTRISCORE, text));
            case WEIGHT_VALUE -> onFullText(ocrResult, this::findWeightValues);
            case WEIGHT_MENTION -> onFullText(ocrResult, text -> findMatches(WEIGHT_MENTION, text));
            case EMAIL -> onFullText(ocrResult, text -> findMatches(EMAIL, text));
            case URL -> onFullText(ocrResult, text -> findMatches(OcrPatterns.URL, text));
            case PHONE_NUMBER -> onFullText(ocrResult, text -> findMatches(PHONE, text));
            case BEST_BEFORE_DATE -> onFullText(ocrResult, this::findBestBeforeDates);
            case RECYCLING_INSTRUCTION -> onContiguousText(ocrResult, this::findRecyclingInstructions);
            case STORAGE_INSTRUCTION -> onContiguousText(ocrResult, this::findStorageInstructions);
        };
    }

    public List<Map<String, Object>> findPackagerCodes(OcrResult ocrResult) {
        List<Map<String, Object>> results = new ArrayList<>();

        PACKAGER_CODES.forEach((regexCode, ocrRegex) -> {
            for (String text : ocrResult.getText(ocrRegex)) {
                Matcher matcher = ocrRegex.pattern().matcher(text);
                while (matcher.find()) {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("raw", matcher.group());
                    result.put(TEXT, ocrRegex.processor().apply(matcher.toMatchResult()));
                    result.put(TYPE, regexCode);
                    results.add(result);
                }
            }
        });
        return results;
    }

    public List<Map<String, Object>> findLabels(OcrResult ocrResult) {
        List<Map<String, Object>> results = new ArrayList<>();

        LABELS.forEach((labelTag, regexList) -> {
            for (OcrRegex ocrRegex : regexList) {
                for (String text : ocrResult.getText(ocrRegex)) {
                    Matcher matcher = ocrRegex.pattern().matcher(text);
                    while (matcher.find()) {
                        String labelValue = ocrRegex.processor() != null
                                ? ocrRegex.processor().apply(matcher.toMatchResult())
                                : labelTag;

                        Map<String, Object> result = new LinkedHashMap<>();
                        result.put("label_tag", labelValue);
                        result.put(TEXT, matcher.group());
                        results.add(result);
                    }
                }
            }
        });
        return results;
    }

    public List<Map<String, Object>> findWeightValues(String text) {
        List<Map<String, Object>> results = new ArrayList<>();
        Matcher matcher = WEIGHT_VALUE.matcher(text);
        while (matcher.find()) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(TEXT, matcher.group());
            result.put("value", matcher.group(1));
            result.put("unit", matcher.group(2));
            results.add(result);
        }
        return results;
    }

    public List<Map<String, Object>> findRecyclingInstructions(String text) {
        List<Map<String, Object>> results = new ArrayList<>();
        RECYCLING.forEach((instructionType, patterns) -> {
            for (Pattern pattern : patterns) {
                Matcher matcher = pattern.matcher(text);
                while (matcher.find()) {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put(TYPE, instructionType);
                    result.put(TEXT, matcher.group());
                    results.add(result);
                }
            }
        });
        return results;
    }

    public List<Map<String, Object>> findBestBeforeDates(String text) {
        List<Map<String, Object>> results = new ArrayList<>();
        BEST_BEFORE_DATES.forEach((type, pattern) -> {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put(TEXT, matcher.group());
                result.put(TYPE, type);
                results.add(result);
            }
        });
        return results;
    }

    public List<Map<String, Object>> findStorageInstructions(String text) {
        String lowercaseText = text.toLowerCase(Locale.ROOT);
        List<Map<String, Object>> results = new ArrayList<>();

        STORAGE_INSTRUCTIONS.forEach((instructionType, pattern) -> {
            Matcher matcher = pattern.matcher(lowercaseText);
            while (matcher.find()) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put(TEXT, matcher.group());
                result.put(TYPE, instructionType);

                if ("max".equals(instructionType)) {
                    result.put("max", extractTemperatureInformation(matcher.group(1)).orElse(null));
                } else if ("between".equals(instructionType)) {
                    Map<String, Object> between = new LinkedHashMap<>();
                    between.put("min", extractTemperatureInformation(matcher.group(1)).orElse(null));
                    between.put("max", extractTemperatureInformation(matcher.group(2)).orElse(null));
                    result.put("between", between);
                }
                results.add(result);
            }
        });
        return results;
    }

    /**
     * Reads {@code value} and {@code unit} from a temperature such as {@code +4°C}.
     */
    public Optional<Map<String, String>> extractTemperatureInformation(String temperature) {
        Matcher matcher = TEMPERATURE.matcher(temperature);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }

        Map<String, String> result = new LinkedHashMap<>();
        result.put("value", matcher.group("value"));
        result.put("unit", matcher.group("unit"));
        return Optional.of(result);
    }

    public List<Map<String, Object>> findMatches(Pattern pattern, String text) {
        List<Map<String, Object>> results = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            results.add(Map.of(TEXT, matcher.group()));
        }
        return results;
    }

    private static List<Map<String, Object>> onFullText(OcrResult ocrResult, TextFinder finder) {
        return ocrResult.getFullText(false).map(finder::find).orElse(Collections.emptyList());
    }

    private static List<Map<String, Object>> onContiguousText(OcrResult ocrResult, TextFinder finder) {
        return ocrResult.getFullTextContiguous(false).map(finder::find).orElse(Collections.emptyList());
    }

    @FunctionalInterface
    private interface TextFinder {
        List<Map<String, Object>> find(String text);
    }
}
