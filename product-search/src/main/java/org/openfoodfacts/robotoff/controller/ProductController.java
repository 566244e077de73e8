package org.openfoodfacts.robotoff.controller;

import lombok.RequiredArgsConstructor;
import org.openfoodfacts.robotoff.dto.ProductDTO;
import org.openfoodfacts.robotoff.dto.ProductRequestDTO;
import org.openfoodfacts.robotoff.dto.ProductResponseDTO;
import org.openfoodfacts.robotoff.service.ProductService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "v1/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @PostMapping
    public ProductResponseDTO getSearchProductsResponse(@RequestBody ProductRequestDTO productRequestDTO) {
        return productService.getSearchProductResponse(productRequestDTO);
    }

    @GetMapping("/{code}")
    public ProductDTO getProduct(@PathVariable("code") String code) {
        return productService.getProductByCode(code);
    }
}
