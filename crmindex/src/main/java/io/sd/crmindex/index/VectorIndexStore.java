package io.sd.crmindex.index;

import io.sd.crmindex.model.EmbeddedEntity;
import io.sd.crmindex.model.Entity;
import io.sd.crmindex.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Índice plano exato em memória. Os vetores são normalizados na construção, pelo que a
 * similaridade de cosseno se reduz ao produto interno com a query normalizada.
 */
public class VectorIndexStore {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexStore.class);

    static final Comparator<Entity> INDEX_ORDER =
            Comparator.comparing(Entity::type).thenComparing(Entity::id);

    private static final Comparator<SearchHit> RANKING =
            Comparator.comparingDouble(SearchHit::score).reversed()
                    .thenComparing(h -> h.entity().id())
                    .thenComparing(h -> h.entity().type());

    private final String modelName;
    private final Clock clock;
    private final AtomicLong generations = new AtomicLong(0);

    public VectorIndexStore(String modelName, Clock clock) {
        this.modelName = modelName;
        this.clock = clock;
    }

    public IndexGeneration build(List<EmbeddedEntity> embedded) {
        int dim = embedded.isEmpty() ? 0 : embedded.get(0).dimension();
        for (EmbeddedEntity e : embedded) {
            if (e.dimension() != dim) {
                throw new DimensionMismatchException(dim, e.dimension());
            }
        }

        List<EmbeddedEntity> ordered = new ArrayList<>(embedded);
        ordered.sort(Comparator.comparing(EmbeddedEntity::entity, INDEX_ORDER));

        List<Entity> entities = new ArrayList<>(ordered.size());
        float[][] vectors = new float[ordered.size()][];
        for (int i = 0; i < ordered.size(); i++) {
            EmbeddedEntity e = ordered.get(i);
            entities.add(e.entity());
            vectors[i] = normalized(e.vector());
        }

        IndexGeneration gen = new IndexGeneration(generations.incrementAndGet(), entities, vectors, dim,
                clock.instant(), modelName);
        log.info("Geração {} construída: {} entidades, dim={}", gen.generation(), gen.size(), dim);
        return gen;
    }

    public List<SearchHit> search(IndexGeneration generation, float[] query, int k) {
        return search(generation, query, k, Set.of(), Double.NEGATIVE_INFINITY);
    }

    /**
     * @param types    tipos aceites; vazio = todos
     * @param minScore similaridade mínima (inclusive)
     */
    public List<SearchHit> search(IndexGeneration generation, float[] query, int k,
                                  Set<EntityType> types, double minScore) {
        if (k <= 0) {
            throw new IllegalArgumentException("k tem de ser positivo: " + k);
        }
        if (generation.isEmpty()) {
            throw new EmptyIndexException("Geração " + generation.generation() + " não tem entidades");
        }
        if (query == null || query.length != generation.dimension()) {
            throw new DimensionMismatchException(generation.dimension(), query == null ? 0 : query.length);
        }

        float[] q = normalized(query);
        List<SearchHit> out = new ArrayList<>();

        for (int i = 0; i < generation.size(); i++) {
            Entity e = generation.entities().get(i);
            if (!types.isEmpty() && !types.contains(e.type())) continue;

            double score = dot(q, generation.vectorRef(i));
            if (score < minScore) continue;
            out.add(new SearchHit(e, score));
        }

        out.sort(RANKING);

        if (out.size() > k) {
            return new ArrayList<>(out.subList(0, k));
        }
        return out;
    }

    public IndexStats stats(IndexGeneration g) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        g.countsByType().forEach((type, n) -> counts.put(type.objectPath(), n));
        return new IndexStats(g.size(), g.dimension(), g.indexKind(), g.modelName(), g.builtAt(),
                g.generation(), Collections.unmodifiableMap(counts));
    }

    private static float[] normalized(float[] v) {
        float[] out = v.clone();
        double norm2 = 0.0;
        for (float x : out) norm2 += (double) x * x;
        if (norm2 == 0.0) return out;
        double inv = 1.0 / Math.sqrt(norm2);
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) (out[i] * inv);
        }
        return out;
    }

    private static double dot(float[] a, float[] b) {
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }
}
