package org.openfoodfacts.robotoff;

import org.openfoodfacts.robotoff.enums.InsightType;
import org.openfoodfacts.robotoff.service.InsightGenerationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Generates OCR insights of the requested type.
 * <p>
 * Usage: {@code SOURCE --insight-type=<type> [--output=<file>] [--keep-empty]}, or with the short forms
 * {@code -t <type>} and {@code -o <file>}, where SOURCE is a JSON file,
 * a (gzipped) JSONL file, a directory containing JSON files, a barcode, or {@code -} to read JSONL from stdin.
 * Output is JSONL, each line containing the insights of one document.
 */
@SpringBootApplication(scanBasePackages = {"org.openfoodfacts.robotoff"})
public class InsightApplication implements ApplicationRunner {

    static final String INSIGHT_TYPE_OPTION = "insight-type";
    static final String OUTPUT_OPTION = "output";
    static final String KEEP_EMPTY_OPTION = "keep-empty";

    // short options come in as two non-option arguments: "-t" "label"
    private static final Map<String, String> SHORT_OPTIONS = Map.of(
            "-t", INSIGHT_TYPE_OPTION,
            "-o", OUTPUT_OPTION);

    @Autowired
    InsightGenerationService insightGenerationService;

    public static void main(String[] args) {
        SpringApplication.run(InsightApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> sources = new ArrayList<>();
        Map<String, String> shortOptionValues = new HashMap<>();
        Iterator<String> nonOptionArgs = args.getNonOptionArgs().iterator();
        while (nonOptionArgs.hasNext()) {
            String arg = nonOptionArgs.next();
            String option = SHORT_OPTIONS.get(arg);
            if (option == null) {
                sources.add(arg);
            } else if (nonOptionArgs.hasNext()) {
                shortOptionValues.put(option, nonOptionArgs.next());
            } else {
                throw new IllegalArgumentException("Option " + arg + " requires a value");
            }
        }

        if (sources.size() != 1) {
            throw new IllegalArgumentException("Exactly one SOURCE argument is expected, got: " + sources);
        }
        String insightTypeName = optionValue(args, shortOptionValues, INSIGHT_TYPE_OPTION);
        if (insightTypeName == null) {
            throw new IllegalArgumentException("Required option: --" + INSIGHT_TYPE_OPTION);
        }

        InsightType insightType = InsightType.fromName(insightTypeName);
        boolean keepEmpty = args.containsOption(KEEP_EMPTY_OPTION);
        String output = optionValue(args, shortOptionValues, OUTPUT_OPTION);

        if (output != null) {
            try (Writer writer = Files.newBufferedWriter(Path.of(output), StandardCharsets.UTF_8)) {
                insightGenerationService.generateInsights(sources.get(0), insightType, writer, keepEmpty);
            }
        } else {
            // stdout stays open, logs go to stderr
            Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
            insightGenerationService.generateInsights(sources.get(0), insightType, writer, keepEmpty);
        }
    }

    /**
     * @return the long form value when given, else the short form one
     */
    private static String optionValue(ApplicationArguments args, Map<String, String> shortOptionValues, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return shortOptionValues.get(option);
        }
        return values.get(values.size() - 1);
    }
}
