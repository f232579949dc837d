package io.sd.crmindex.model;

import java.util.Objects;

public record EmbeddedEntity(Entity entity, float[] vector) {

    public EmbeddedEntity {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(vector, "vector");
        vector = vector.clone();
    }

    public int dimension() {
        return vector.length;
    }
}
