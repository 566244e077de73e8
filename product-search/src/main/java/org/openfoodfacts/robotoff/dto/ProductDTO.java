package org.openfoodfacts.robotoff.dto;

import lombok.Builder;

@Builder
public record ProductDTO(String code,
                         String ingredientsTextFr,
                         Double score) {
}
