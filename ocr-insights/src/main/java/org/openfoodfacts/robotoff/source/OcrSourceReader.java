package org.openfoodfacts.robotoff.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openfoodfacts.robotoff.client.OffClient;
import org.openfoodfacts.robotoff.utils.BarcodeUtil;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * Resolves an input argument into OCR documents: a barcode, a directory of JSON files,
 * a JSON file, a (gzipped) JSONL archive, or {@code -} for JSONL on standard input.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OcrSourceReader {

    public static final String STDIN = "-";

    private static final String CONTENT = "content";
    private static final String SOURCE = "source";

    private final OffClient offClient;

    private final ObjectMapper objectMapper;

    public void read(String input, Consumer<OcrDocument> consumer) throws IOException {
        if (STDIN.equals(input)) {
            readJsonLines(System.in, consumer);
        } else if (BarcodeUtil.isBarcode(input)) {
            readFromBarcode(input, consumer);
        } else {
            readFromPath(Path.of(input), consumer);
        }
    }

    public void readFromBarcode(String barcode, Consumer<OcrDocument> consumer) {
        for (String imageName : offClient.fetchImageNames(barcode)) {
            if (!isDigits(imageName)) {
                continue;
            }
            log.info("Getting OCR for image {}", imageName);
            offClient.fetchOcrJson(barcode, imageName).ifPresent(content ->
                    consumer.accept(new OcrDocument(BarcodeUtil.getSource(imageName, barcode), content)));
        }
    }

    public void readFromPath(Path inputPath, Consumer<OcrDocument> consumer) throws IOException {
        if (!Files.exists(inputPath)) {
            log.warn("Unrecognized input: {}", inputPath);
            return;
        }

        if (Files.isDirectory(inputPath)) {
            readDirectory(inputPath, consumer);
            return;
        }

        List<String> suffixes = suffixes(inputPath.getFileName().toString());
        boolean gzipped = !suffixes.isEmpty() && suffixes.get(suffixes.size() - 1).equals(".gz");
        if (suffixes.contains(".json")) {
            try (InputStream inputStream = open(inputPath, gzipped)) {
                consumer.accept(new OcrDocument(null, objectMapper.readTree(inputStream)));
            }
        } else if (suffixes.contains(".jsonl")) {
            try (InputStream inputStream = open(inputPath, gzipped)) {
                readJsonLines(inputStream, consumer);
            }
        } else {
            log.warn("Unrecognized input: {}", inputPath);
        }
    }

    /**
     * Reads archive lines of the form {@code {"source": "/301/762/042/2003/1.json", "content": {...}}};
     * lines without content are skipped.
     */
    public void readJsonLines(InputStream inputStream, Consumer<OcrDocument> consumer) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        String line;
        long lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }

            JsonNode jsonLine;
            try {
                jsonLine = objectMapper.readTree(line);
            } catch (JsonProcessingException ex) {
                log.warn("Skipping malformed line {}: {}", lineNumber, ex.getOriginalMessage());
                continue;
            }

            if (jsonLine.has(CONTENT)) {
                String source = jsonLine.hasNonNull(SOURCE) ? jsonLine.get(SOURCE).asText().replace("//", "/") : null;
                consumer.accept(new OcrDocument(source, jsonLine.get(CONTENT)));
            }
        }
    }

    private void readDirectory(Path directory, Consumer<OcrDocument> consumer) throws IOException {
        List<Path> jsonPaths;
        try (Stream<Path> paths = Files.walk(directory)) {
            jsonPaths = paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        }

        for (Path jsonPath : jsonPaths) {
            JsonNode content;
            try (InputStream inputStream = Files.newInputStream(jsonPath)) {
                content = objectMapper.readTree(inputStream);
            }
            consumer.accept(new OcrDocument(sourceOf(jsonPath), content));
        }
    }

    private static String sourceOf(Path jsonPath) {
        String fileName = jsonPath.getFileName().toString();
        String imageName = fileName.substring(0, fileName.length() - ".json".length());
        String barcode = BarcodeUtil.getBarcodeFromPath(jsonPath.toString());
        try {
            return BarcodeUtil.getSource(imageName, barcode);
        } catch (IllegalArgumentException ex) {
            log.warn("No barcode can be derived from {}, source left empty", jsonPath);
            return null;
        }
    }

    private static InputStream open(Path path, boolean gzipped) throws IOException {
        InputStream inputStream = Files.newInputStream(path);
        return gzipped ? new GZIPInputStream(inputStream) : inputStream;
    }

    /**
     * {@code ocr.jsonl.gz} gives {@code [.jsonl, .gz]}.
     */
    static List<String> suffixes(String fileName) {
        String name = fileName.startsWith(".") ? fileName.substring(1) : fileName;
        String[] parts = name.split("\\.");
        return Stream.of(parts).skip(1).map(part -> "." + part).toList();
    }

    private static boolean isDigits(String text) {
        return !text.isEmpty() && text.chars().allMatch(Character::isDigit);
    }
}
