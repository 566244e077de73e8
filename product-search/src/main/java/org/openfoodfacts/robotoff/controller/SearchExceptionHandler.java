package org.openfoodfacts.robotoff.controller;

import lombok.extern.slf4j.Slf4j;
import org.openfoodfacts.robotoff.dto.ErrorResponseDTO;
import org.openfoodfacts.robotoff.exception.InvalidSearchRequestException;
import org.openfoodfacts.robotoff.exception.ProductNotFoundException;
import org.openfoodfacts.robotoff.exception.SearchServiceUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class SearchExceptionHandler {

    @ExceptionHandler(ProductNotFoundException.class)
    public ResponseEntity<ErrorResponseDTO> handleNotFound(ProductNotFoundException ex) {
        return new ResponseEntity<>(new ErrorResponseDTO("not_found", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InvalidSearchRequestException.class)
    public ResponseEntity<ErrorResponseDTO> handleInvalidRequest(InvalidSearchRequestException ex) {
        return new ResponseEntity<>(new ErrorResponseDTO("invalid_request", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(new ErrorResponseDTO("invalid_request", "Malformed request body"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SearchServiceUnavailableException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnavailable(SearchServiceUnavailableException ex) {
        log.warn("Answering 503: {}", ex.getMessage());
        return new ResponseEntity<>(new ErrorResponseDTO("search_unavailable", ex.getMessage()), HttpStatus.SERVICE_UNAVAILABLE);
    }
}
