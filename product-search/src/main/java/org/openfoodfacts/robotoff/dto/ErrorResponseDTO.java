package org.openfoodfacts.robotoff.dto;

public record ErrorResponseDTO(String error, String message) {
}
