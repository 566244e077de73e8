package org.openfoodfacts.robotoff.exception;

public class ProductNotFoundException extends RuntimeException {
    public ProductNotFoundException(String code) {
        super("No product with code " + code);
    }
}
