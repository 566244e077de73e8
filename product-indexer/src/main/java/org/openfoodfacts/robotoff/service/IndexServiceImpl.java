package org.openfoodfacts.robotoff.service;

import com.google.common.io.Resources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.ElasticsearchException;
import org.elasticsearch.action.admin.indices.alias.IndicesAliasesRequest;
import org.elasticsearch.action.admin.indices.alias.get.GetAliasesRequest;
import org.elasticsearch.action.admin.indices.delete.DeleteIndexRequest;
import org.elasticsearch.action.admin.indices.refresh.RefreshRequest;
import org.elasticsearch.action.support.master.AcknowledgedResponse;
import org.elasticsearch.client.GetAliasesResponse;
import org.elasticsearch.client.RequestOptions;
import org.elasticsearch.client.RestHighLevelClient;
import org.elasticsearch.client.indices.CreateIndexRequest;
import org.elasticsearch.client.indices.CreateIndexResponse;
import org.elasticsearch.client.indices.GetIndexRequest;
import org.elasticsearch.xcontent.XContentType;
import org.openfoodfacts.robotoff.config.EsFieldsConfig;
import org.openfoodfacts.robotoff.exception.IndexOperationException;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class IndexServiceImpl implements IndexService {

    private static final DateTimeFormatter INDEX_SUFFIX_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final RestHighLevelClient esClient;

    private final EsFieldsConfig esFieldsConfig;

    private final Clock clock;

    @Override
    public String createIndex() throws IOException {
        String aliasName = esFieldsConfig.getIndex().getAlias();
        String generatedUniqueIndexName = generateUniqueIndexName(aliasName);

        String settings = getStrFromResource(esFieldsConfig.getFile().getSettings());
        String mappings = getStrFromResource(esFieldsConfig.getFile().getMappings());
        createIndex(generatedUniqueIndexName, settings, mappings);

        updateIndexAlias(aliasName, generatedUniqueIndexName);
        esClient.indices().refresh(new RefreshRequest(generatedUniqueIndexName), RequestOptions.DEFAULT);
        return generatedUniqueIndexName;
    }

    @Override
    public void deletePreviousIndices(String indexPrefix, Long keepIndices) throws IOException {
        if (keepIndices == null || keepIndices < 1) {
            throw new IllegalArgumentException("At least one index version must be kept, got: " + keepIndices);
        }

        GetIndexRequest getIndexRequest = new GetIndexRequest(indexPrefix + "_*");

        List<String> allIndices = Arrays.asList(esClient.indices().get(getIndexRequest, RequestOptions.DEFAULT).getIndices());

        // index suffixes are timestamps, so the lexical order is the creation order
        List<String> indicesToDelete = allIndices
                .stream()
                .sorted(Comparator.reverseOrder())
                .skip(keepIndices)
                .toList();

        for (String index : indicesToDelete) {
            deleteIndex(index);
        }
        log.info("{} previous version(s) of {} deleted, {} kept.", indicesToDelete.size(), indexPrefix,
                allIndices.size() - indicesToDelete.size());
    }

    private void updateIndexAlias(String aliasName, String generatedUniqueIndexName) {
        try {
            IndicesAliasesRequest aliasesRequest = new IndicesAliasesRequest();
            removeAliasesAction(aliasesRequest, aliasName);
            addAliasAction(aliasesRequest, aliasName, generatedUniqueIndexName);
            AcknowledgedResponse response = esClient.indices().updateAliases(aliasesRequest, RequestOptions.DEFAULT);
            if (!response.isAcknowledged()) {
                throw new IndexOperationException("Alias update not acknowledged for alias: " + aliasName);
            }
            log.info("Alias {} now points to {}.", aliasName, generatedUniqueIndexName);
        } catch (IOException | ElasticsearchException | IndexOperationException e) {
            log.error("Alias {} could not be moved to {}, rolling the new index back.", aliasName, generatedUniqueIndexName, e);
            deleteIndex(generatedUniqueIndexName);
            throw new IndexOperationException("Failed to point alias " + aliasName + " to " + generatedUniqueIndexName, e);
        }
    }

    private void removeAliasesAction(IndicesAliasesRequest indicesAliasesRequest, String aliasName) throws IOException {
        GetAliasesResponse response = esClient.indices().getAlias(
                new GetAliasesRequest(aliasName), RequestOptions.DEFAULT);

        List<String> indicesToBeCleared = response.getAliases().entrySet()
                .stream()
                .filter(entry -> entry.getValue().stream().anyMatch(alias -> aliasName.equals(alias.alias())))
                .map(Map.Entry::getKey)
                .toList();

        if (!indicesToBeCleared.isEmpty()) {
            IndicesAliasesRequest.AliasActions removeAction = new IndicesAliasesRequest.AliasActions(IndicesAliasesRequest.AliasActions.Type.REMOVE)
                    .indices(indicesToBeCleared.toArray(new String[0]))
                    .alias(aliasName);

            indicesAliasesRequest.addAliasAction(removeAction);
        }
    }

    private void addAliasAction(IndicesAliasesRequest indicesAliasesRequest, String aliasName, String generatedUniqueIndexName) {
        IndicesAliasesRequest.AliasActions addAction =
                new IndicesAliasesRequest.AliasActions(IndicesAliasesRequest.AliasActions.Type.ADD)
                        .index(generatedUniqueIndexName)
                        .alias(aliasName);

        indicesAliasesRequest.addAliasAction(addAction);
    }

    private String generateUniqueIndexName(String generalName) {
        return generalName + "_" + LocalDateTime.now(clock).format(INDEX_SUFFIX_FORMATTER);
    }

    static String getStrFromResource(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new IllegalArgumentException("File not found: " + (resource != null ? resource.getFilename() : null));
        }
        try {
            return Resources.toString(resource.getURL(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Can not read resource file: " + resource.getFilename(), ex);
        }
    }

    private void createIndex(String indexName, String settings, String mappings) {
        CreateIndexRequest createIndexRequest = new CreateIndexRequest(indexName)
                .mapping(mappings, XContentType.JSON)
                .settings(settings, XContentType.JSON);

        CreateIndexResponse createIndexResponse;
        try {
            createIndexResponse = esClient.indices().create(createIndexRequest, RequestOptions.DEFAULT);
        } catch (IOException ex) {
            throw new IndexOperationException("An error occurred during creating ES index " + indexName, ex);
        }

        if (!createIndexResponse.isAcknowledged()) {
            throw new IndexOperationException("Creating index not acknowledged for indexName: " + indexName);
        }
        log.info("Index {} has been created.", indexName);
    }

    private void deleteIndex(String indexName) {
        try {
            DeleteIndexRequest deleteRequest = new DeleteIndexRequest(indexName);
            AcknowledgedResponse acknowledgedResponse = esClient.indices().delete(deleteRequest, RequestOptions.DEFAULT);
            if (!acknowledgedResponse.isAcknowledged()) {
                log.warn("Index deletion is not acknowledged for indexName: {}", indexName);
            } else {
                log.info("Index {} has been deleted.", indexName);
            }
        } catch (IOException ex) {
            throw new IndexOperationException("Deleting of index failed for indexName: " + indexName, ex);
        }
    }
}
