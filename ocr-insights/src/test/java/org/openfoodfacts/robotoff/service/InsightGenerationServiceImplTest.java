package org.openfoodfacts.robotoff.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openfoodfacts.robotoff.client.OffClient;
import org.openfoodfacts.robotoff.enums.InsightType;
import org.openfoodfacts.robotoff.extraction.OcrInsightExtractor;
import org.openfoodfacts.robotoff.source.OcrSourceReader;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class InsightGenerationServiceImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InsightGenerationServiceImpl insightGenerationService;

    @TempDir
    Path tempDir;

    private Path imageDir;

    @BeforeEach
    void setUp() throws IOException {
        insightGenerationService = new InsightGenerationServiceImpl(
                new OcrSourceReader(mock(OffClient.class), objectMapper), new OcrInsightExtractor(), objectMapper);

        imageDir = Files.createDirectories(tempDir.resolve("301/762/042/2003"));
        copyFixture("ocr/sample_ocr.json", imageDir.resolve("1.json"));
        copyFixture("ocr/error_ocr.json", imageDir.resolve("2.json"));
        Files.writeString(imageDir.resolve("3.json"), "{\"responses\":[{\"fullTextAnnotation\":{\"text\":\"Sucre\"}}]}");
    }

    @Test
    void testWritesOneLinePerDocumentWithInsights() throws IOException {
        StringWriter output = new StringWriter();

        long written = insightGenerationService.generateInsights(tempDir.toString(), InsightType.PACKAGER_CODE, output, false);

        assertEquals(1, written);
        List<String> lines = output.toString().lines().toList();
        assertEquals(1, lines.size());

        JsonNode line = objectMapper.readTree(lines.get(0));
        assertEquals(List.of("insights", "barcode", "type", "source"), fieldNames(line));
        assertEquals("3017620422003", line.get("barcode").asText());
        assertEquals("packager_code", line.get("type").asText());
        assertEquals("/301/762/042/2003/1.jpg", line.get("source").asText());
        assertEquals(2, line.get("insights").size());
        assertEquals("EMB 35360C", line.at("/insights/0/text").asText());
    }

    @Test
    void testKeepEmptyWritesDocumentsWithoutInsights() throws IOException {
        StringWriter output = new StringWriter();

        long written = insightGenerationService.generateInsights(tempDir.toString(), InsightType.PACKAGER_CODE, output, true);

        // the error response is still skipped
        assertEquals(2, written);
        JsonNode emptyLine = objectMapper.readTree(output.toString().lines().toList().get(1));
        assertEquals("/301/762/042/2003/3.jpg", emptyLine.get("source").asText());
        assertTrue(emptyLine.get("insights").isEmpty());
    }

    @Test
    void testUnknownSourceKeepsNullBarcode() throws IOException {
        Path jsonFile = tempDir.resolve("single.json");
        copyFixture("ocr/sample_ocr.json", jsonFile);
        StringWriter output = new StringWriter();

        insightGenerationService.generateInsights(jsonFile.toString(), InsightType.NUTRISCORE, output, false);

        JsonNode line = objectMapper.readTree(output.toString().trim());
        assertTrue(line.has("barcode"));
        assertTrue(line.get("barcode").isNull());
        assertFalse(line.has("source"));
        assertEquals("Nutri-Score", line.at("/insights/0/text").asText());
    }

    @Test
    void testWriteFailureIsPropagated() {
        Writer closedWriter = new Writer() {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("Stream closed");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        IOException ex = assertThrows(IOException.class, () ->
                insightGenerationService.generateInsights(tempDir.toString(), InsightType.PACKAGER_CODE, closedWriter, false));
        assertEquals("Stream closed", ex.getMessage());
    }

    @Test
    void testErrorResponseIsIgnored() throws IOException {
        try (InputStream inputStream = new ClassPathResource("ocr/error_ocr.json").getInputStream()) {
            assertTrue(InsightGenerationServiceImpl.getOcrResponse(objectMapper.readTree(inputStream)).isEmpty());
        }
        assertTrue(InsightGenerationServiceImpl.getOcrResponse(objectMapper.createObjectNode()).isEmpty());
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static void copyFixture(String resource, Path target) throws IOException {
        try (InputStream inputStream = new ClassPathResource(resource).getInputStream()) {
            Files.copy(inputStream, target);
        }
    }
}
