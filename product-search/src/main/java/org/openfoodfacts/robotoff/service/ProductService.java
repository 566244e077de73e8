package org.openfoodfacts.robotoff.service;

import org.openfoodfacts.robotoff.dto.ProductDTO;
import org.openfoodfacts.robotoff.dto.ProductRequestDTO;
import org.openfoodfacts.robotoff.dto.ProductResponseDTO;

public interface ProductService {
    ProductResponseDTO getSearchProductResponse(ProductRequestDTO productRequestDTO);

    ProductDTO getProductByCode(String code);
}
