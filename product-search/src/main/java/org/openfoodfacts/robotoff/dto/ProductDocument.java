package org.openfoodfacts.robotoff.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Source of a product index document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductDocument(String code,
                              @JsonProperty("ingredients_text_fr")
                              String ingredientsTextFr) {
}
