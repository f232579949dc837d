package io.sd.crmindex.rest;

import io.sd.crmindex.cache.CacheState;
import io.sd.crmindex.emb.EmbeddingFunction;
import io.sd.crmindex.index.IndexGeneration;
import io.sd.crmindex.index.VectorIndexStore;
import io.sd.crmindex.model.EmbeddedEntity;
import io.sd.crmindex.model.Entity;
import io.sd.crmindex.model.EntityType;
import io.sd.crmindex.reindex.RebuildInProgressException;
import io.sd.crmindex.reindex.RebuildState;
import io.sd.crmindex.reindex.RebuildSummary;
import io.sd.crmindex.reindex.ReindexOrchestrator;
import io.sd.crmindex.reindex.TypeOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IndexController.class)
class IndexControllerTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReindexOrchestrator orchestrator;

    @MockBean
    private CacheState cacheState;

    @MockBean
    private VectorIndexStore store;

    @MockBean
    private EmbeddingFunction embeddingFunction;

    private final VectorIndexStore realStore = new VectorIndexStore("fake-model", Clock.systemUTC());

    @BeforeEach
    void setUp() {
        when(embeddingFunction.modelName()).thenReturn("fake-model");
        when(cacheState.current()).thenReturn(Optional.empty());
        when(cacheState.lastJobSummary()).thenReturn(Optional.empty());
        when(orchestrator.activeJob()).thenReturn(Optional.empty());
    }

    private static RebuildSummary summary(RebuildState state, String error) {
        List<TypeOutcome> outcomes = List.of(
                new TypeOutcome(EntityType.CONTACT, true, 2, 0, 2, true, null),
                new TypeOutcome(EntityType.COMPANY, true, 0, 0, 0, false, "HTTP 403"),
                new TypeOutcome(EntityType.DEAL, true, 3, 1, 3, true, null));
        return new RebuildSummary("job-1", state, STARTED, STARTED.plusSeconds(4), outcomes, 5, 5, error,
                List.of("[CLEARING]", "[LOADING]"), null);
    }

    private IndexGeneration generation() {
        IndexGeneration g = realStore.build(List.of(
                new EmbeddedEntity(new Entity("c1", EntityType.CONTACT, "Ana Silva", Map.of("firstname", "Ana")),
                        new float[]{1f, 0f}),
                new EmbeddedEntity(new Entity("d1", EntityType.DEAL, "Renovação", Map.of()),
                        new float[]{0f, 1f})));
        when(store.stats(g)).thenReturn(realStore.stats(g));
        return g;
    }

    @Test
    void forceReindex_done_shouldReturnSummary() throws Exception {
        when(orchestrator.triggerReindex()).thenReturn(summary(RebuildState.DONE, null));

        mockMvc.perform(post("/force-reindex"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value("job-1"))
                .andExpect(jsonPath("$.state").value("DONE"))
                .andExpect(jsonPath("$.started_at").value("2024-05-01T10:00:00Z"))
                .andExpect(jsonPath("$.total_embedded").value(5))
                .andExpect(jsonPath("$.outcomes[0].type").value("contacts"))
                .andExpect(jsonPath("$.outcomes[1].succeeded").value(false))
                .andExpect(jsonPath("$.outcomes[1].error").value("HTTP 403"))
                .andExpect(jsonPath("$.outcomes[2].skipped_count").value(1))
                .andExpect(jsonPath("$.log[0]").value("[CLEARING]"));
    }

    @Test
    void forceReindex_failed_shouldReturn500WithSummary() throws Exception {
        when(orchestrator.triggerReindex())
                .thenReturn(summary(RebuildState.FAILED, "Nenhum tipo de entidade foi carregado"));

        mockMvc.perform(post("/force-reindex"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.error").value("Nenhum tipo de entidade foi carregado"));
    }

    @Test
    void forceReindex_inProgress_shouldReturn409() throws Exception {
        when(orchestrator.triggerReindex()).thenThrow(new RebuildInProgressException("job-0"));

        mockMvc.perform(post("/force-reindex"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.path").value("/force-reindex"))
                .andExpect(jsonPath("$.message").value("Reindex já em curso (job job-0)"));
    }

    @Test
    void stats_beforeFirstBuild_shouldReportNotInitialized() throws Exception {
        mockMvc.perform(get("/index/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not_initialized"))
                .andExpect(jsonPath("$.total_entities").value(0))
                .andExpect(jsonPath("$.index_kind").value("flat"))
                .andExpect(jsonPath("$.model_name").value("fake-model"))
                .andExpect(jsonPath("$.last_job").doesNotExist());
    }

    @Test
    void stats_afterBuild_shouldDescribePublishedGeneration() throws Exception {
        IndexGeneration g = generation();
        when(cacheState.current()).thenReturn(Optional.of(g));
        when(cacheState.lastJobSummary()).thenReturn(Optional.of(summary(RebuildState.DONE, null)));

        mockMvc.perform(get("/index/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"))
                .andExpect(jsonPath("$.index.total_entities").value(2))
                .andExpect(jsonPath("$.index.dimension").value(2))
                .andExpect(jsonPath("$.index.index_kind").value("flat"))
                .andExpect(jsonPath("$.index.counts_by_type.contacts").value(1))
                .andExpect(jsonPath("$.last_job.state").value("DONE"));
    }

    @Test
    void entities_beforeFirstBuild_shouldReturn503() throws Exception {
        mockMvc.perform(get("/index/entities"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("not_ready"));
    }

    @Test
    void entities_shouldDumpIndexedContent() throws Exception {
        IndexGeneration g = generation();
        when(cacheState.current()).thenReturn(Optional.of(g));

        mockMvc.perform(get("/index/entities").param("include_content", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_indexed").value(2))
                .andExpect(jsonPath("$.types_count.deals").value(1))
                .andExpect(jsonPath("$.indexed_entities[0].entity_type").value("contacts"))
                .andExpect(jsonPath("$.indexed_entities[0].entity_id").value("c1"))
                .andExpect(jsonPath("$.indexed_entities[0].searchable_text").value("Ana Silva"))
                .andExpect(jsonPath("$.indexed_entities[0].text_length").value(9))
                .andExpect(jsonPath("$.indexed_entities[0].properties.firstname").value("Ana"))
                .andExpect(jsonPath("$.indexed_entities[1].entity_id").value("d1"));
    }

    private IndexGeneration largeGeneration() {
        List<EmbeddedEntity> entities = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            entities.add(new EmbeddedEntity(
                    new Entity(String.format("c%02d", i), EntityType.CONTACT, "Contacto " + i, Map.of()), new float[]{1f, 0f}));
        }
        entities.add(new EmbeddedEntity(
                new Entity("d1", EntityType.DEAL, "Renovação ACME Portugal", Map.of()), new float[]{0f, 1f}));
        IndexGeneration g = realStore.build(entities);
        when(store.stats(g)).thenReturn(realStore.stats(g));
        when(cacheState.current()).thenReturn(Optional.of(g));
        return g;
    }

    @Test
    void entities_default_shouldReturnFirstPageWithoutContent() throws Exception {
        largeGeneration();

        mockMvc.perform(get("/index/entities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_indexed").value(26))
                .andExpect(jsonPath("$.total_matching").value(26))
                .andExpect(jsonPath("$.offset").value(0))
                .andExpect(jsonPath("$.limit").value(20))
                .andExpect(jsonPath("$.next_offset").value(20))
                .andExpect(jsonPath("$.indexed_entities.length()").value(20))
                .andExpect(jsonPath("$.indexed_entities[0].text_length").value(10))
                .andExpect(jsonPath("$.indexed_entities[0].searchable_text").doesNotExist())
                .andExpect(jsonPath("$.indexed_entities[0].properties").doesNotExist());
    }

    @Test
    void entities_lastPage_shouldOmitNextOffset() throws Exception {
        largeGeneration();

        mockMvc.perform(get("/index/entities").param("offset", "20").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.indexed_entities.length()").value(6))
                .andExpect(jsonPath("$.indexed_entities[0].entity_id").value("c20"))
                .andExpect(jsonPath("$.indexed_entities[0].index").value(20))
                .andExpect(jsonPath("$.indexed_entities[5].entity_id").value("d1"))
                .andExpect(jsonPath("$.next_offset").doesNotExist());
    }

    @Test
    void entities_shouldFilterByTypeAndText() throws Exception {
        largeGeneration();

        mockMvc.perform(get("/index/entities").param("entity_type", "deals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_matching").value(1))
                .andExpect(jsonPath("$.indexed_entities[0].entity_id").value("d1"))
                .andExpect(jsonPath("$.indexed_entities[0].index").value(25));

        // Then - pesquisa sem distinguir maiúsculas
        mockMvc.perform(get("/index/entities").param("search_text", "acme portugal"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_matching").value(1))
                .andExpect(jsonPath("$.indexed_entities[0].entity_type").value("deals"));

        mockMvc.perform(get("/index/entities").param("entity_type", "contacts").param("search_text", "ACME"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_matching").value(0))
                .andExpect(jsonPath("$.indexed_entities.length()").value(0));
    }

    @Test
    void entities_invalidPaging_shouldReturn400() throws Exception {
        largeGeneration();

        mockMvc.perform(get("/index/entities").param("limit", "101"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/index/entities").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/index/entities").param("offset", "-1"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/index/entities").param("entity_type", "tickets"))
                .andExpect(status().isBadRequest());
    }
}
