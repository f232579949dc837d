package io.sd.crmindex.index;

import io.sd.crmindex.model.Entity;
import io.sd.crmindex.model.EntityType;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot imutável do índice. Construído apenas por {@link VectorIndexStore#build}; depois de publicado
 * nunca é alterado, só substituído por uma geração mais recente.
 */
public final class IndexGeneration {

    public static final String KIND_FLAT = "flat";

    private final long generation;
    private final List<Entity> entities;
    private final float[][] vectors; // normalizados (norma L2 = 1, ou zero)
    private final int dimension;
    private final Instant builtAt;
    private final String modelName;
    private final Map<EntityType, Integer> countsByType;

    IndexGeneration(long generation, List<Entity> entities, float[][] vectors, int dimension,
                    Instant builtAt, String modelName) {
        this.generation = generation;
        this.entities = List.copyOf(entities);
        this.vectors = vectors;
        this.dimension = dimension;
        this.builtAt = builtAt;
        this.modelName = modelName;

        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        for (Entity e : this.entities) counts.merge(e.type(), 1, Integer::sum);
        this.countsByType = Collections.unmodifiableMap(counts);
    }

    public long generation() { return generation; }
    public int size() { return entities.size(); }
    public boolean isEmpty() { return entities.isEmpty(); }
    public int dimension() { return dimension; }
    public String indexKind() { return KIND_FLAT; }
    public Instant builtAt() { return builtAt; }
    public String modelName() { return modelName; }
    public Map<EntityType, Integer> countsByType() { return countsByType; }

    /** Entidades pela ordem do índice (tipo, id). */
    public List<Entity> entities() {
        return entities;
    }

    /** Cópia do vetor normalizado na posição {@code i}. */
    public float[] vector(int i) {
        return vectors[i].clone();
    }

    float[] vectorRef(int i) {
        return vectors[i];
    }
}
