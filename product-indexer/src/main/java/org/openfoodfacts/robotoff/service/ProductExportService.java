package org.openfoodfacts.robotoff.service;

import java.io.IOException;

public interface ProductExportService {

    /**
     * Sends every eligible product of the configured dataset to the product alias.
     *
     * @return the number of documents sent to Elasticsearch
     */
    long exportProducts() throws IOException;
}
