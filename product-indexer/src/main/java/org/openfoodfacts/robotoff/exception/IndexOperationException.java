package org.openfoodfacts.robotoff.exception;

public class IndexOperationException extends RuntimeException {
    public IndexOperationException(String message) {
        super(message);
    }

    public IndexOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
