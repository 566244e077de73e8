package org.openfoodfacts.robotoff.service;

import org.openfoodfacts.robotoff.enums.InsightType;

import java.io.IOException;
import java.io.Writer;

public interface InsightGenerationService {

    /**
     * Extracts insights from every OCR document of the input and writes one JSON line per document.
     *
     * @param keepEmpty whether documents without any insight are written too
     * @return the number of lines written
     */
    long generateInsights(String input, InsightType insightType, Writer output, boolean keepEmpty) throws IOException;
}
