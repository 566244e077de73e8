package org.openfoodfacts.robotoff.service;

import java.io.IOException;

public interface IndexService {

    /**
     * Creates a new timestamped product index, points the alias at it and refreshes it.
     *
     * @return the name of the created index
     */
    String createIndex() throws IOException;

    void deletePreviousIndices(String indexPrefix, Long keepIndices) throws IOException;
}
