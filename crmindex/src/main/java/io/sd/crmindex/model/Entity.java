package io.sd.crmindex.model;

import java.util.Map;
import java.util.Objects;

/**
 * Registo CRM normalizado. O {@code text} é o que segue para o modelo de embeddings;
 * {@code properties} guarda todas as propriedades do registo, incluindo as desconhecidas.
 */
public record Entity(String id, EntityType type, String text, Map<String, String> properties) {

    public Entity {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        text = text == null ? "" : text;
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
