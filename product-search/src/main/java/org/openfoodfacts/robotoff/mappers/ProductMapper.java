package org.openfoodfacts.robotoff.mappers;

import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import org.openfoodfacts.robotoff.dto.ProductDTO;
import org.openfoodfacts.robotoff.dto.ProductDocument;
import org.openfoodfacts.robotoff.dto.ProductResponseDTO;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

@Component
public class ProductMapper {

    public List<ProductDTO> mapHitsToProducts(SearchResponse<ProductDocument> response) {
        return response.hits().hits().stream()
                .filter(hit -> Objects.nonNull(hit.source()))
                .map(this::toProductDTO)
                .toList();
    }

    public ProductDTO toProductDTO(Hit<ProductDocument> hit) {
        ProductDocument source = hit.source();
        return ProductDTO.builder()
                .code(source.code())
                .ingredientsTextFr(source.ingredientsTextFr())
                .score(hit.score())
                .build();
    }

    public ProductResponseDTO toProductResponseDTO(SearchResponse<ProductDocument> response) {
        List<ProductDTO> products = mapHitsToProducts(response);

        return ProductResponseDTO.builder()
                .totalHits(response.hits().total() != null
                        ? response.hits().total().value()
                        : 0L)
                .productDTOList(products)
                .build();
    }
}
