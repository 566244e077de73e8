package org.openfoodfacts.robotoff.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.action.bulk.BulkItemResponse;
import org.elasticsearch.action.bulk.BulkRequest;
import org.elasticsearch.action.bulk.BulkResponse;
import org.elasticsearch.action.index.IndexRequest;
import org.elasticsearch.client.RequestOptions;
import org.elasticsearch.client.RestHighLevelClient;
import org.elasticsearch.xcontent.XContentType;
import org.openfoodfacts.robotoff.config.EsFieldsConfig;
import org.openfoodfacts.robotoff.dataset.ProductDatasetReader;
import org.openfoodfacts.robotoff.dto.ProductDocument;
import org.openfoodfacts.robotoff.exception.IndexOperationException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static io.micrometer.common.util.StringUtils.isBlank;

@Component
@Slf4j
@RequiredArgsConstructor
public class ProductExportServiceImpl implements ProductExportService {

    static final String CODE = "code";
    static final String INGREDIENTS_TEXT_FR = "ingredients_text_fr";
    static final String COUNTRIES_TAGS = "countries_tags";
    static final String STATES_TAGS = "states_tags";
    static final String QUALITY_TAGS = "quality_tags";

    private final RestHighLevelClient esClient;

    private final EsFieldsConfig esFieldsConfig;

    private final ProductDatasetReader productDatasetReader;

    private final ObjectMapper objectMapper;

    @Override
    public long exportProducts() throws IOException {
        String aliasName = esFieldsConfig.getIndex().getAlias();
        int batchSize = esFieldsConfig.getExport().getBatchSize();
        List<ProductDocument> batch = new ArrayList<>(batchSize);
        long[] exported = {0};

        try {
            long read = productDatasetReader.forEachProduct(esFieldsConfig.getFile().getDataset(), product ->
                    toProductDocument(product).ifPresent(document -> {
                        batch.add(document);
                        if (batch.size() >= batchSize) {
                            exported[0] += sendBatch(aliasName, batch);
                            batch.clear();
                        }
                    }));

            if (!batch.isEmpty()) {
                exported[0] += sendBatch(aliasName, batch);
            }
            log.info("{} products exported to {} out of {} read from the dataset.", exported[0], aliasName, read);
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }
        return exported[0];
    }

    Optional<ProductDocument> toProductDocument(JsonNode product) {
        String code = product.path(CODE).asText("");
        String ingredientsText = product.path(INGREDIENTS_TEXT_FR).asText("");
        if (isBlank(code) || isBlank(ingredientsText)) {
            return Optional.empty();
        }

        EsFieldsConfig.Export export = esFieldsConfig.getExport();
        if (!isBlank(export.getCountryTag()) && !containsTag(product.path(COUNTRIES_TAGS), export.getCountryTag())) {
            return Optional.empty();
        }
        if (!isBlank(export.getStateTag()) && !containsTag(product.path(STATES_TAGS), export.getStateTag())) {
            return Optional.empty();
        }
        JsonNode qualityTags = product.path(QUALITY_TAGS);
        if (export.getExcludedQualityTags().stream().anyMatch(tag -> containsTag(qualityTags, tag))) {
            return Optional.empty();
        }

        return Optional.of(ProductDocument.builder()
                .code(code.trim())
                .ingredientsTextFr(normalizeIngredientText(ingredientsText))
                .build());
    }

    static String normalizeIngredientText(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    private static boolean containsTag(JsonNode tags, String tag) {
        if (!tags.isArray()) {
            return false;
        }
        for (JsonNode value : tags) {
            if (tag.equals(value.asText())) {
                return true;
            }
        }
        return false;
    }

    private int sendBatch(String aliasName, List<ProductDocument> documents) {
        BulkRequest bulkRequest = new BulkRequest();
        for (ProductDocument document : documents) {
            bulkRequest.add(new IndexRequest(aliasName)
                    .id(document.code())
                    .source(toJson(document), XContentType.JSON));
        }

        BulkResponse bulkResponse;
        try {
            bulkResponse = esClient.bulk(bulkRequest, RequestOptions.DEFAULT);
        } catch (IOException ex) {
            log.error("An exception occurred during bulk data processing", ex);
            throw new UncheckedIOException(ex);
        }

        if (bulkResponse.getItems().length != documents.size()) {
            log.warn("Only {} out of {} requests have been processed in a bulk request.", bulkResponse.getItems().length, documents.size());
        } else {
            log.debug("{} requests have been processed in a bulk request.", bulkResponse.getItems().length);
        }

        int failed = 0;
        if (bulkResponse.hasFailures()) {
            failed = (int) Arrays.stream(bulkResponse.getItems()).filter(BulkItemResponse::isFailed).count();
            log.warn("{} document(s) rejected in bulk data processing:\n{}", failed, bulkResponse.buildFailureMessage());
        }
        return bulkResponse.getItems().length - failed;
    }

    private String toJson(ProductDocument document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IndexOperationException("Can not serialize product " + document.code(), ex);
        }
    }
}
