package org.openfoodfacts.robotoff;

import org.junit.jupiter.api.Test;
import org.openfoodfacts.robotoff.service.IndexService;
import org.openfoodfacts.robotoff.service.ProductExportService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.io.IOException;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
class IndexApplicationTest {

    @Autowired
    private IndexApplication indexApplication;

    @MockBean
    private IndexService indexService;

    @MockBean
    private ProductExportService productExportService;

    @Test
    void testCreateNewIndexKeepsConfiguredAmountOfVersions() throws IOException {
        indexApplication.run(IndexApplication.CREATE_NEW_INDEX_ARG);

        var order = inOrder(indexService);
        order.verify(indexService).createIndex();
        order.verify(indexService).deletePreviousIndices("product", 2L);
        verify(productExportService, never()).exportProducts();
    }

    @Test
    void testExportProductsDoesNotTouchIndices() throws IOException {
        indexApplication.run(IndexApplication.EXPORT_PRODUCTS_ARG);

        verify(productExportService).exportProducts();
        verify(indexService, never()).createIndex();
        verify(indexService, never()).deletePreviousIndices(anyString(), anyLong());
    }
}
