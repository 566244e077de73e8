package org.openfoodfacts.robotoff.service;

import org.elasticsearch.action.admin.indices.alias.IndicesAliasesRequest;
import org.elasticsearch.action.admin.indices.alias.get.GetAliasesRequest;
import org.elasticsearch.action.admin.indices.delete.DeleteIndexRequest;
import org.elasticsearch.action.admin.indices.refresh.RefreshRequest;
import org.elasticsearch.action.support.master.AcknowledgedResponse;
import org.elasticsearch.client.GetAliasesResponse;
import org.elasticsearch.client.IndicesClient;
import org.elasticsearch.client.RequestOptions;
import org.elasticsearch.client.RestHighLevelClient;
import org.elasticsearch.client.indices.CreateIndexRequest;
import org.elasticsearch.client.indices.CreateIndexResponse;
import org.elasticsearch.client.indices.GetIndexRequest;
import org.elasticsearch.client.indices.GetIndexResponse;
import org.elasticsearch.cluster.metadata.AliasMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.openfoodfacts.robotoff.config.EsFieldsConfig;
import org.openfoodfacts.robotoff.exception.IndexOperationException;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IndexServiceImplTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);

    private final RestHighLevelClient esClient = mock(RestHighLevelClient.class);

    private final IndicesClient indicesClient = mock(IndicesClient.class);

    private EsFieldsConfig esFieldsConfig;

    private IndexServiceImpl indexService;

    @BeforeEach
    void setUp() throws IOException {
        EsFieldsConfig.Index index = new EsFieldsConfig.Index();
        index.setAlias("product");
        index.setIndicesAmount(2L);

        EsFieldsConfig.File file = new EsFieldsConfig.File();
        file.setSettings(new ClassPathResource("elastic/product/settings.json"));
        file.setMappings(new ClassPathResource("elastic/product/mappings.json"));

        esFieldsConfig = new EsFieldsConfig();
        esFieldsConfig.setIndex(index);
        esFieldsConfig.setFile(file);

        indexService = new IndexServiceImpl(esClient, esFieldsConfig, CLOCK);

        when(esClient.indices()).thenReturn(indicesClient);

        CreateIndexResponse createIndexResponse = mock(CreateIndexResponse.class);
        when(createIndexResponse.isAcknowledged()).thenReturn(true);
        when(indicesClient.create(any(CreateIndexRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(createIndexResponse);

        GetAliasesResponse getAliasesResponse = mock(GetAliasesResponse.class);
        when(getAliasesResponse.getAliases()).thenReturn(Map.of(
                "product_20240201000000", Set.of(AliasMetadata.newAliasMetadataBuilder("product").build()),
                "category_20240201000000", Set.of(AliasMetadata.newAliasMetadataBuilder("category").build())));
        when(indicesClient.getAlias(any(GetAliasesRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(getAliasesResponse);

        AcknowledgedResponse acknowledged = mock(AcknowledgedResponse.class);
        when(acknowledged.isAcknowledged()).thenReturn(true);
        when(indicesClient.updateAliases(any(IndicesAliasesRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(acknowledged);
        when(indicesClient.delete(any(DeleteIndexRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(acknowledged);
    }

    @Test
    void testCreateIndexUsesTimestampedNameAndShippedDefinition() throws IOException {
        String indexName = indexService.createIndex();

        assertEquals("product_20240301101530", indexName);
        ArgumentCaptor<CreateIndexRequest> captor = ArgumentCaptor.forClass(CreateIndexRequest.class);
        verify(indicesClient).create(captor.capture(), eq(RequestOptions.DEFAULT));
        assertEquals("product_20240301101530", captor.getValue().index());
        assertThat(captor.getValue().mappings().utf8ToString(), containsString("\"trigram\""));
        assertEquals("1", captor.getValue().settings().get("index.number_of_shards"));
        assertEquals("reverse", captor.getValue().settings().getAsList("analysis.analyzer.reverse.filter").get(1));
        verify(indicesClient).refresh(any(RefreshRequest.class), eq(RequestOptions.DEFAULT));
    }

    @Test
    void testAliasMovesFromPreviousIndexToNewOne() throws IOException {
        indexService.createIndex();

        ArgumentCaptor<IndicesAliasesRequest> captor = ArgumentCaptor.forClass(IndicesAliasesRequest.class);
        verify(indicesClient).updateAliases(captor.capture(), eq(RequestOptions.DEFAULT));
        List<IndicesAliasesRequest.AliasActions> actions = captor.getValue().getAliasActions();

        assertEquals(2, actions.size());
        assertEquals(IndicesAliasesRequest.AliasActions.Type.REMOVE, actions.get(0).actionType());
        assertThat(actions.get(0).indices(), arrayContaining("product_20240201000000"));
        assertEquals(IndicesAliasesRequest.AliasActions.Type.ADD, actions.get(1).actionType());
        assertThat(actions.get(1).indices(), arrayContaining("product_20240301101530"));
        assertThat(actions.get(1).aliases(), arrayContaining("product"));
    }

    @Test
    void testNewIndexIsDeletedWhenAliasUpdateFails() throws IOException {
        doThrow(new IOException("timeout")).when(indicesClient)
                .updateAliases(any(IndicesAliasesRequest.class), eq(RequestOptions.DEFAULT));

        assertThrows(IndexOperationException.class, () -> indexService.createIndex());

        ArgumentCaptor<DeleteIndexRequest> captor = ArgumentCaptor.forClass(DeleteIndexRequest.class);
        verify(indicesClient).delete(captor.capture(), eq(RequestOptions.DEFAULT));
        assertThat(captor.getValue().indices(), arrayContaining("product_20240301101530"));
        verify(indicesClient, never()).refresh(any(RefreshRequest.class), eq(RequestOptions.DEFAULT));
    }

    @Test
    void testUnacknowledgedCreationFails() throws IOException {
        CreateIndexResponse notAcknowledged = mock(CreateIndexResponse.class);
        when(indicesClient.create(any(CreateIndexRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(notAcknowledged);

        assertThrows(IndexOperationException.class, () -> indexService.createIndex());
        verify(indicesClient, never()).updateAliases(any(IndicesAliasesRequest.class), eq(RequestOptions.DEFAULT));
    }

    @Test
    void testMissingSettingsFileIsRejected() {
        esFieldsConfig.getFile().setSettings(new ClassPathResource("elastic/product/missing.json"));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> indexService.createIndex());
        assertEquals("File not found: missing.json", ex.getMessage());
    }

    @Test
    void testOnlyMostRecentIndicesAreKept() throws IOException {
        GetIndexResponse getIndexResponse = mock(GetIndexResponse.class);
        when(getIndexResponse.getIndices()).thenReturn(new String[]{
                "product_20240101000000", "product_20240301101530", "product_20240201000000", "product_20231201000000"});
        when(indicesClient.get(any(GetIndexRequest.class), eq(RequestOptions.DEFAULT))).thenReturn(getIndexResponse);

        indexService.deletePreviousIndices("product", 2L);

        ArgumentCaptor<DeleteIndexRequest> captor = ArgumentCaptor.forClass(DeleteIndexRequest.class);
        verify(indicesClient, times(2)).delete(captor.capture(), eq(RequestOptions.DEFAULT));
        List<String> deleted = captor.getAllValues().stream().map(request -> request.indices()[0]).toList();
        assertThat(deleted, containsInAnyOrder("product_20240101000000", "product_20231201000000"));
    }

    @Test
    void testKeepingNoIndexIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> indexService.deletePreviousIndices("product", 0L));
    }
}
