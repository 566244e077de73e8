package org.openfoodfacts.robotoff.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * One output line: the insights found in one OCR document.
 */
@Builder
@JsonPropertyOrder({"insights", "barcode", "type", "source"})
public record InsightRecord(List<Map<String, Object>> insights,
                            @JsonInclude(JsonInclude.Include.ALWAYS)
                            String barcode,
                            String type,
                            @JsonInclude(JsonInclude.Include.NON_NULL)
                            String source) {
}
