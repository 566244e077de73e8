package org.openfoodfacts.robotoff.extraction;

import lombok.experimental.UtilityClass;
import org.openfoodfacts.robotoff.ocr.OcrField;
import org.openfoodfacts.robotoff.ocr.OcrRegex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Patterns recognised in OCR text, keyed by the sub-type or tag they produce.
 */
@UtilityClass
public class OcrPatterns {

    private static final int CASE_INSENSITIVE = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // \w, \d and \s match any script, not only ASCII
    private static final int UNICODE = Pattern.UNICODE_CHARACTER_CLASS;

    public static final Pattern NUTRISCORE = Pattern.compile("nutri[-\\s]?score", CASE_INSENSITIVE);

    public static final List<String> WEIGHT_MENTIONS = List.of(
            "poids net:",
            "poids net égoutté:",
            "net weight:",
            "peso neto:",
            "peso liquido:",
            "netto gewicht:");

    public static final Pattern WEIGHT_MENTION = Pattern.compile(WEIGHT_MENTIONS.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|")), CASE_INSENSITIVE);

    public static final Pattern WEIGHT_VALUE = Pattern.compile(
            "([0-9]+[,.]?[0-9]*)\\s*(fl oz|dl|cl|mg|mL|lbs|oz|g|kg|L)(?![^\\s])");

    // the whole text has to be the URL
    public static final Pattern URL = Pattern.compile(
            "^(http://www\\.|https://www\\.|http://|https://)?[a-z0-9]+([\\-.][a-z0-9]+)*\\.[a-z]{2,5}(:[0-9]{1,5})?(/.*)?$");

    public static final Pattern EMAIL = Pattern.compile("[\\w.-]+@[\\w.-]+", UNICODE);

    public static final Pattern PHONE = Pattern.compile(
            "\\d{3}[-.\\s]??\\d{3}[-.\\s]??\\d{4}|\\(\\d{3}\\)\\s*\\d{3}[-.\\s]??\\d{4}|\\d{3}[-.\\s]??\\d{4}", UNICODE);

    public static final Map<String, OcrRegex> PACKAGER_CODES = ordered(
            Map.entry("fr_emb", OcrRegex.builder()
                    .pattern(Pattern.compile("(EMB) ?(\\d ?\\d ?\\d ?\\d ?\\d)([a-zA-Z]{1,2})?", CASE_INSENSITIVE))
                    .field(OcrField.TEXT_ANNOTATIONS)
                    .processor(OcrPatterns::processFrEmbMatch)
                    .build()),
            Map.entry("eu_fr", OcrRegex.builder()
                    .pattern(Pattern.compile("(FR) (\\d{1,3})[\\-\\s.](\\d{1,3})[\\-\\s.](\\d{1,3}) (CE|EC)", CASE_INSENSITIVE))
                    .field(OcrField.FULL_TEXT_CONTIGUOUS)
                    .processor(OcrPatterns::processFrPackagingMatch)
                    .build()));

    public static final Map<String, List<Pattern>> RECYCLING = ordered(
            Map.entry("recycling", List.of(Pattern.compile("recycle", CASE_INSENSITIVE))),
            Map.entry("throw_away", List.of(Pattern.compile("(?:throw away)|(?:jeter)", CASE_INSENSITIVE))));

    public static final Map<String, List<OcrRegex>> LABELS = ordered(
            Map.entry("en:organic", List.of(
                    contiguousLowercase(Pattern.compile("ingr[ée]dients?\\sbiologiques?", CASE_INSENSITIVE)),
                    contiguousLowercase(Pattern.compile("ingr[ée]dients?\\sbio[\\s.,)]")),
                    contiguousLowercase(Pattern.compile("agriculture ue/non ue biologique")),
                    contiguousLowercase(Pattern.compile("agriculture bio(?:logique)?[\\s.,)]")),
                    contiguousLowercase(Pattern.compile("production bio(?:logique)?[\\s.,)]")))),
            Map.entry("xx-bio-xx", List.of(OcrRegex.builder()
                    .pattern(Pattern.compile("([A-Z]{2})[\\-\\s.](BIO|ÖKO)[\\-\\s.](\\d{2,3})"))
                    .field(OcrField.TEXT_ANNOTATIONS)
                    .processor(OcrPatterns::processEuBioLabelCode)
                    .build())),
            Map.entry("fr:ab-agriculture-biologique", List.of(
                    contiguousLowercase(Pattern.compile("certifi[ée] ab[\\s.,)]")))));

    public static final Map<String, Pattern> BEST_BEFORE_DATES = ordered(
            Map.entry("en", Pattern.compile("\\d\\d\\s(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)(?:\\s\\d{4})?", CASE_INSENSITIVE | UNICODE)),
            Map.entry("fr", Pattern.compile("\\d\\d\\s(?:Jan|Fev|Mar|Avr|Mai|Juin|Juil|Aou|Sep|Oct|Nov|Dec)(?:\\s\\d{4})?", CASE_INSENSITIVE | UNICODE)),
            Map.entry("full_digits", Pattern.compile("\\d{2}[./]\\d{2}[./](?:\\d{2}){1,2}", UNICODE)));

    private static final String TEMPERATURE_PATTERN = "[+-]?\\s*\\d+\\s*°?C";

    public static final Pattern TEMPERATURE = Pattern.compile("(?<value>[+-]?\\s*\\d+)\\s*°?(?<unit>C)", CASE_INSENSITIVE);

    public static final Map<String, Pattern> STORAGE_INSTRUCTIONS = ordered(
            Map.entry("max", Pattern.compile("[aà] conserver [àa] (" + TEMPERATURE_PATTERN + ") maximum", CASE_INSENSITIVE)),
            Map.entry("between", Pattern.compile("[aà] conserver entre (" + TEMPERATURE_PATTERN + ") et (" + TEMPERATURE_PATTERN + ")",
                    CASE_INSENSITIVE)));

    /**
     * {@code FR 62.765.032 CE}
     */
    static String processFrPackagingMatch(MatchResult match) {
        return String.format("%s %s.%s.%s %s",
                match.group(1).toUpperCase(Locale.ROOT), match.group(2), match.group(3), match.group(4),
                match.group(5).toUpperCase(Locale.ROOT));
    }

    /**
     * {@code EMB 35360C}
     */
    static String processFrEmbMatch(MatchResult match) {
        String cityCode = match.group(2).replace(" ", "");
        String companyCode = match.group(3) != null ? match.group(3).toUpperCase(Locale.ROOT) : "";
        return match.group(1).toUpperCase(Locale.ROOT) + " " + cityCode + companyCode;
    }

    static String processEuBioLabelCode(MatchResult match) {
        return match.group(1) + "-" + match.group(2) + "-" + match.group(3);
    }

    private static OcrRegex contiguousLowercase(Pattern pattern) {
        return OcrRegex.builder()
                .pattern(pattern)
                .field(OcrField.FULL_TEXT_CONTIGUOUS)
                .lowercase(true)
                .build();
    }

    @SafeVarargs
    private static <V> Map<String, V> ordered(Map.Entry<String, V>... entries) {
        Map<String, V> map = new LinkedHashMap<>();
        for (Map.Entry<String, V> entry : entries) {
            map.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(map);
    }
}
