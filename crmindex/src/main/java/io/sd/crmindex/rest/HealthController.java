package io.sd.crmindex.rest;

import io.sd.crmindex.cache.CacheState;
import io.sd.crmindex.emb.EmbeddingFunction;
import io.sd.crmindex.index.IndexGeneration;
import io.sd.crmindex.reindex.ReindexOrchestrator;
import io.sd.crmindex.source.CrmSource;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final CacheState cacheState;
    private final CrmSource crmSource;
    private final EmbeddingFunction embeddingFunction;
    private final ReindexOrchestrator orchestrator;

    public HealthController(CacheState cacheState, CrmSource crmSource, EmbeddingFunction embeddingFunction,
                            ReindexOrchestrator orchestrator) {
        this.cacheState = cacheState;
        this.crmSource = crmSource;
        this.embeddingFunction = embeddingFunction;
        this.orchestrator = orchestrator;
    }

    /** Processo vivo. */
    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "healthy",
                "model_name", embeddingFunction.modelName(),
                "crm_configured", crmSource.isConfigured(),
                "rebuild_running", orchestrator.isRunning()
        );
    }

    /** Pronto quando já existe uma geração publicada. */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        var current = cacheState.current();
        if (current.isEmpty()) {
            return ResponseEntity.status(503).body(Map.of(
                    "status", "not_ready",
                    "error", "índice ainda não construído"
            ));
        }
        IndexGeneration g = current.get();
        return ResponseEntity.ok(Map.of(
                "status", "ready",
                "generation", g.generation(),
                "total_entities", g.size()
        ));
    }
}
