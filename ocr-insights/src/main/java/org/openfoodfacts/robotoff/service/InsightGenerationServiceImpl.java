package org.openfoodfacts.robotoff.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openfoodfacts.robotoff.dto.InsightRecord;
import org.openfoodfacts.robotoff.enums.InsightType;
import org.openfoodfacts.robotoff.extraction.OcrInsightExtractor;
import org.openfoodfacts.robotoff.ocr.OcrResult;
import org.openfoodfacts.robotoff.source.OcrDocument;
import org.openfoodfacts.robotoff.source.OcrSourceReader;
import org.openfoodfacts.robotoff.utils.BarcodeUtil;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class InsightGenerationServiceImpl implements InsightGenerationService {

    private final OcrSourceReader ocrSourceReader;

    private final OcrInsightExtractor ocrInsightExtractor;

    private final ObjectMapper objectMapper;

    @Override
    public long generateInsights(String input, InsightType insightType, Writer output, boolean keepEmpty) throws IOException {
        long[] counters = {0, 0};

        try {
            ocrSourceReader.read(input, document -> {
                counters[0]++;
                getOcrResponse(document.content())
                        .map(OcrResult::fromJson)
                        .map(ocrResult -> ocrInsightExtractor.extractInsights(ocrResult, insightType))
                        .filter(insights -> keepEmpty || !insights.isEmpty())
                        .ifPresent(insights -> {
                            writeLine(output, toRecord(document, insightType, insights));
                            counters[1]++;
                        });
            });
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }

        output.flush();
        log.info("{} {} insight line(s) written from {} OCR document(s)", counters[1], insightType.getName(), counters[0]);
        return counters[1];
    }

    /**
     * @return the first annotation response, empty when missing or reporting an error
     */
    static Optional<JsonNode> getOcrResponse(JsonNode data) {
        JsonNode responses = data.path("responses");
        if (!responses.isArray() || responses.isEmpty()) {
            return Optional.empty();
        }

        JsonNode response = responses.get(0);
        if (response.has("error")) {
            log.debug("OCR response carries an error: {}", response.get("error"));
            return Optional.empty();
        }
        return Optional.of(response);
    }

    private static InsightRecord toRecord(OcrDocument document, InsightType insightType, List<Map<String, Object>> insights) {
        return InsightRecord.builder()
                .insights(insights)
                .barcode(BarcodeUtil.getBarcodeFromPath(document.source()))
                .type(insightType.getName())
                .source(document.source())
                .build();
    }

    private void writeLine(Writer output, InsightRecord insightRecord) {
        try {
            output.write(objectMapper.writeValueAsString(insightRecord));
            output.write('\n');
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
