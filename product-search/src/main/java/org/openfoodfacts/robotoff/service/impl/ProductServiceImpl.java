package org.openfoodfacts.robotoff.service.impl;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openfoodfacts.robotoff.config.EsFieldsConfig;
import org.openfoodfacts.robotoff.dto.ProductDTO;
import org.openfoodfacts.robotoff.dto.ProductDocument;
import org.openfoodfacts.robotoff.dto.ProductRequestDTO;
import org.openfoodfacts.robotoff.dto.ProductResponseDTO;
import org.openfoodfacts.robotoff.enums.MatchType;
import org.openfoodfacts.robotoff.exception.InvalidSearchRequestException;
import org.openfoodfacts.robotoff.exception.ProductNotFoundException;
import org.openfoodfacts.robotoff.exception.SearchServiceUnavailableException;
import org.openfoodfacts.robotoff.mappers.ProductMapper;
import org.openfoodfacts.robotoff.service.ProductService;
import org.openfoodfacts.robotoff.utils.QueryUtil;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Objects;

import static org.openfoodfacts.robotoff.dto.ProductResponseDTO.buildEmptyProductResponseDTO;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductServiceImpl implements ProductService {

    private final ElasticsearchClient elasticsearchClient;

    private final EsFieldsConfig esFieldsConfig;

    private final ProductMapper productMapper;

    @Override
    public ProductResponseDTO getSearchProductResponse(ProductRequestDTO productRequestDTO) {
        if (Objects.isNull(productRequestDTO.queryText()) || productRequestDTO.queryText().isBlank()) {
            return buildEmptyProductResponseDTO();
        }

        EsFieldsConfig.Request requestDefaults = esFieldsConfig.getRequest();
        int size = productRequestDTO.getValidatedSize(requestDefaults.getDefaultQuerySize());
        int page = productRequestDTO.getValidatedPage(requestDefaults.getDefaultQueryPage());
        long from = productRequestDTO.from(requestDefaults.getDefaultQuerySize(), requestDefaults.getDefaultQueryPage());
        validatePagination(size, page, from, requestDefaults);

        MatchType matchType = productRequestDTO.getValidatedMatchType();
        Query query = QueryUtil.buildQueryByMatchType(matchType, productRequestDTO.queryText(), esFieldsConfig);

        SearchRequest searchRequest = SearchRequest.of(s -> s
                .index(esFieldsConfig.getIndex().getAlias())
                .from((int) from)
                .size(size)
                .query(query)
                .sort(so -> so.score(ss -> ss.order(SortOrder.Desc)))
        );

        SearchResponse<ProductDocument> searchResponse = search(searchRequest);
        log.debug("{} search for '{}' matched {} product(s)", matchType, productRequestDTO.queryText(),
                searchResponse.hits().total() != null ? searchResponse.hits().total().value() : 0);
        return productMapper.toProductResponseDTO(searchResponse);
    }

    @Override
    public ProductDTO getProductByCode(String code) {
        SearchRequest searchRequest = SearchRequest.of(s -> s
                .index(esFieldsConfig.getIndex().getAlias())
                .size(1)
                .query(QueryUtil.buildCodeQuery(code, esFieldsConfig.getFields().getCode()))
        );

        return search(searchRequest).hits().hits().stream()
                .filter(hit -> Objects.nonNull(hit.source()))
                .findFirst()
                .map(productMapper::toProductDTO)
                .orElseThrow(() -> new ProductNotFoundException(code));
    }

    private SearchResponse<ProductDocument> search(SearchRequest searchRequest) {
        try {
            return elasticsearchClient.search(searchRequest, ProductDocument.class);
        } catch (IOException | ElasticsearchException ex) {
            log.error("Search on {} failed", searchRequest.index(), ex);
            throw new SearchServiceUnavailableException("Product search is unavailable", ex);
        }
    }

    private static void validatePagination(int size, int page, long from, EsFieldsConfig.Request request) {
        if (size < 0 || page < 0) {
            throw new InvalidSearchRequestException("size and page must not be negative");
        }
        if (request.getMaxQuerySize() != null && size > request.getMaxQuerySize()) {
            throw new InvalidSearchRequestException("size must not exceed " + request.getMaxQuerySize());
        }
        if (request.getMaxResultWindow() != null && from + size > request.getMaxResultWindow()) {
            throw new InvalidSearchRequestException("page * size + size must not exceed " + request.getMaxResultWindow());
        }
    }
}
