package io.sd.crmindex.search;

import io.sd.crmindex.cache.CacheState;
import io.sd.crmindex.emb.EmbeddingException;
import io.sd.crmindex.emb.EmbeddingFunction;
import io.sd.crmindex.index.EmptyIndexException;
import io.sd.crmindex.index.IndexException;
import io.sd.crmindex.index.IndexGeneration;
import io.sd.crmindex.index.SearchHit;
import io.sd.crmindex.index.VectorIndexStore;
import io.sd.crmindex.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Pesquisa semântica sobre a geração publicada no momento da chamada.
 */
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final CacheState cacheState;
    private final VectorIndexStore store;
    private final EmbeddingFunction embeddings;

    public SearchService(CacheState cacheState, VectorIndexStore store, EmbeddingFunction embeddings) {
        this.cacheState = cacheState;
        this.store = store;
        this.embeddings = embeddings;
    }

    public List<SearchHit> search(String query, int topK) {
        return search(query, topK, Set.of(), Double.NEGATIVE_INFINITY);
    }

    /**
     * @throws EmptyIndexException se ainda não houver geração publicada, ou se estiver vazia
     */
    public List<SearchHit> search(String query, int topK, Set<EntityType> types, double threshold) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        // fixa a geração antes de embeddar: um publish a meio não afeta esta query
        IndexGeneration generation = cacheState.current()
                .orElseThrow(() -> new EmptyIndexException("Índice ainda não construído"));

        float[] qVec;
        try {
            qVec = embeddings.embed(List.of(query)).get(0);
        } catch (EmbeddingException e) {
            log.warn("Falha a gerar embedding para query '{}': {}", query, e.toString());
            throw new IndexException("Falha a gerar embedding da query", e);
        }

        List<SearchHit> hits = store.search(generation, qVec, topK, types, threshold);
        log.debug("Query '{}' na geração {}: {} resultados", query, generation.generation(), hits.size());
        return hits;
    }
}
