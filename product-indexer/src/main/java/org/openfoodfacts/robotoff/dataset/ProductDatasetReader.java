package org.openfoodfacts.robotoff.dataset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import java.util.zip.GZIPInputStream;

import static io.micrometer.common.util.StringUtils.isBlank;

/**
 * Streams the Open Food Facts JSONL product dump, one product object per line.
 * Files ending with {@code .gz} are decompressed on the fly.
 */
@Component
@Slf4j
public class ProductDatasetReader {

    private static final String GZIP_SUFFIX = ".gz";

    private final ObjectMapper objectMapper;

    public ProductDatasetReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the number of lines that could be parsed as JSON objects
     */
    public long forEachProduct(Resource dataset, Consumer<JsonNode> consumer) throws IOException {
        if (!dataset.exists()) {
            throw new IllegalArgumentException("Dataset not found: " + dataset.getDescription());
        }

        long parsed = 0;
        long lineNumber = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(open(dataset), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (isBlank(line)) {
                    continue;
                }

                JsonNode product;
                try {
                    product = objectMapper.readTree(line);
                } catch (JsonProcessingException ex) {
                    log.warn("Skipping malformed dataset line {}: {}", lineNumber, ex.getOriginalMessage());
                    continue;
                }

                if (product == null || !product.isObject()) {
                    log.warn("Skipping dataset line {}: not a JSON object", lineNumber);
                    continue;
                }

                parsed++;
                consumer.accept(product);
            }
        }
        return parsed;
    }

    private static InputStream open(Resource dataset) throws IOException {
        InputStream inputStream = dataset.getInputStream();
        String filename = dataset.getFilename();
        if (filename != null && filename.endsWith(GZIP_SUFFIX)) {
            return new GZIPInputStream(inputStream);
        }
        return inputStream;
    }
}
