package io.sd.crmindex.rest;

import io.sd.crmindex.cache.CacheState;
import io.sd.crmindex.emb.EmbeddingFunction;
import io.sd.crmindex.index.IndexGeneration;
import io.sd.crmindex.index.IndexStats;
import io.sd.crmindex.index.VectorIndexStore;
import io.sd.crmindex.model.Entity;
import io.sd.crmindex.model.EntityType;
import io.sd.crmindex.reindex.RebuildState;
import io.sd.crmindex.reindex.RebuildSummary;
import io.sd.crmindex.reindex.ReindexOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
public class IndexController {

    static final int MAX_PAGE = 100;

    private final ReindexOrchestrator orchestrator;
    private final CacheState cacheState;
    private final VectorIndexStore store;
    private final EmbeddingFunction embeddingFunction;

    public IndexController(ReindexOrchestrator orchestrator, CacheState cacheState, VectorIndexStore store,
                           EmbeddingFunction embeddingFunction) {
        this.orchestrator = orchestrator;
        this.cacheState = cacheState;
        this.store = store;
        this.embeddingFunction = embeddingFunction;
    }

    /** Limpa e reconstrói o índice. Bloqueia até o job terminar. */
    @PostMapping("/force-reindex")
    public ResponseEntity<RebuildSummary> forceReindex() {
        RebuildSummary summary = orchestrator.triggerReindex();
        HttpStatus status = summary.state() == RebuildState.DONE ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(summary);
    }

    @GetMapping("/index/stats")
    public Map<String, Object> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        var current = cacheState.current();
        if (current.isPresent()) {
            body.put("status", "ready");
            body.put("index", store.stats(current.get()));
        } else {
            body.put("status", "not_initialized");
            body.put("total_entities", 0);
            body.put("index_kind", IndexGeneration.KIND_FLAT);
            body.put("model_name", embeddingFunction.modelName());
        }
        cacheState.lastJobSummary().ifPresent(j -> body.put("last_job", j));
        orchestrator.activeJob().ifPresent(j -> body.put("active_job", j));
        return body;
    }

    /**
     * Conteúdo indexado da geração publicada, paginado. Filtros opcionais por tipo e por texto
     * (sem distinguir maiúsculas); {@code include_content} junta o texto e as propriedades.
     */
    @GetMapping("/index/entities")
    public ResponseEntity<Map<String, Object>> entities(
            @RequestParam(name = "entity_type", required = false) String entityType,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "search_text", required = false) String searchText,
            @RequestParam(name = "include_content", defaultValue = "false") boolean includeContent
    ) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset tem de ser >= 0: " + offset);
        }
        if (limit < 1 || limit > MAX_PAGE) {
            throw new IllegalArgumentException("limit tem de estar entre 1 e " + MAX_PAGE + ": " + limit);
        }
        EntityType type = entityType == null || entityType.isBlank() ? null : EntityType.fromObjectPath(entityType.trim());
        String needle = searchText == null || searchText.isBlank() ? null : searchText.toLowerCase(Locale.ROOT);

        var current = cacheState.current();
        if (current.isEmpty()) {
            return ResponseEntity.status(503).body(Map.of(
                    "status", "not_ready",
                    "error", "índice ainda não construído"
            ));
        }

        IndexGeneration g = current.get();
        int matching = 0;
        List<Map<String, Object>> items = new ArrayList<>();
        for (int i = 0; i < g.size(); i++) {
            Entity e = g.entities().get(i);
            if (type != null && e.type() != type) continue;
            if (needle != null && !e.text().toLowerCase(Locale.ROOT).contains(needle)) continue;

            int position = matching++;
            if (position < offset || items.size() >= limit) continue;

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("index", i);
            item.put("entity_type", e.type());
            item.put("entity_id", e.id());
            item.put("text_length", e.text().length());
            if (includeContent) {
                item.put("searchable_text", e.text());
                item.put("properties", e.properties());
            }
            items.add(item);
        }

        IndexStats stats = store.stats(g);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("index", stats);
        body.put("total_indexed", g.size());
        body.put("types_count", stats.countsByType());
        body.put("total_matching", matching);
        body.put("offset", offset);
        body.put("limit", limit);
        if (offset + limit < matching) {
            body.put("next_offset", offset + limit);
        }
        body.put("indexed_entities", items);
        return ResponseEntity.ok(body);
    }
}
