package org.openfoodfacts.robotoff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openfoodfacts.robotoff.enums.InsightType;
import org.openfoodfacts.robotoff.service.InsightGenerationService;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class InsightApplicationTest {

    private final InsightGenerationService insightGenerationService = mock(InsightGenerationService.class);

    private final InsightApplication insightApplication = new InsightApplication();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        insightApplication.insightGenerationService = insightGenerationService;
    }

    @Test
    void testOutputFileAndKeepEmpty() throws IOException {
        Path output = tempDir.resolve("insights.jsonl");
        when(insightGenerationService.generateInsights(anyString(), any(), any(), anyBoolean())).thenAnswer(invocation -> {
            Writer writer = invocation.getArgument(2);
            writer.write("{}\n");
            return 1L;
        });

        insightApplication.run(new DefaultApplicationArguments(
                "3017620422003", "--insight-type=label", "--output=" + output, "--keep-empty"));

        verify(insightGenerationService).generateInsights(eq("3017620422003"), eq(InsightType.LABEL), any(Writer.class), eq(true));
        assertEquals("{}\n", Files.readString(output));
    }

    @Test
    void testShortOptions() throws IOException {
        Path output = tempDir.resolve("labels.jsonl");

        insightApplication.run(new DefaultApplicationArguments("-t", "label", "ocr.jsonl.gz", "-o", output.toString()));

        verify(insightGenerationService).generateInsights(eq("ocr.jsonl.gz"), eq(InsightType.LABEL), any(Writer.class), eq(false));
        assertTrue(Files.exists(output));
    }

    @Test
    void testShortOptionWithoutValue() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                insightApplication.run(new DefaultApplicationArguments("ocr.jsonl", "-t")));

        assertEquals("Option -t requires a value", ex.getMessage());
        verifyNoInteractions(insightGenerationService);
    }

    @Test
    void testInsightTypeIsRequired() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                insightApplication.run(new DefaultApplicationArguments("ocr.jsonl")));

        assertEquals("Required option: --insight-type", ex.getMessage());
        verifyNoInteractions(insightGenerationService);
    }

    @Test
    void testExactlyOneSource() {
        assertThrows(IllegalArgumentException.class, () ->
                insightApplication.run(new DefaultApplicationArguments("--insight-type=label")));
        assertThrows(IllegalArgumentException.class, () ->
                insightApplication.run(new DefaultApplicationArguments("a.json", "b.json", "--insight-type=label")));
        verifyNoInteractions(insightGenerationService);
    }

    @Test
    void testUnknownInsightType() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                insightApplication.run(new DefaultApplicationArguments("ocr.jsonl", "--insight-type=logo")));

        assertEquals("unknown insight type: logo", ex.getMessage());
    }

    @Test
    void testDefaultsToStdoutWithoutEmptyDocuments() throws IOException {
        insightApplication.run(new DefaultApplicationArguments("-", "--insight-type=email"));

        verify(insightGenerationService).generateInsights(eq("-"), eq(InsightType.EMAIL), any(Writer.class), eq(false));
    }
}
