package org.openfoodfacts.robotoff.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record ProductDocument(String code,
                              @JsonProperty("ingredients_text_fr")
                              String ingredientsTextFr) {
}
