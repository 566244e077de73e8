package org.openfoodfacts.robotoff.ocr;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public record OcrTextAnnotation(String locale, String text, List<Vertex> boundingPoly) {

    public record Vertex(int x, int y) {
    }

    public static OcrTextAnnotation fromJson(JsonNode data) {
        List<Vertex> vertices = new ArrayList<>();
        for (JsonNode vertex : data.path("boundingPoly").path("vertices")) {
            vertices.add(new Vertex(vertex.path("x").asInt(0), vertex.path("y").asInt(0)));
        }

        JsonNode locale = data.get("locale");
        return new OcrTextAnnotation(
                locale != null ? locale.asText() : null,
                data.path("description").asText(""),
                List.copyOf(vertices));
    }
}
