package io.sd.crmindex.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.sd.crmindex.model.Entity;
import io.sd.crmindex.model.EntityType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converte um objeto CRM em bruto ({@code {"id": ..., "properties": {...}}}) numa {@link Entity}.
 * Sem estado e sem I/O.
 */
@Component
public class EntityNormalizer {

    public Entity normalize(JsonNode raw, EntityType type) {
        if (raw == null || !raw.isObject()) {
            throw new MalformedRecordException("Registo " + type.objectPath() + " não é um objeto JSON");
        }

        JsonNode idNode = raw.path("id");
        String id = idNode.isValueNode() ? idNode.asText("").trim() : "";
        if (id.isEmpty()) {
            throw new MalformedRecordException("Registo " + type.objectPath() + " sem id");
        }

        Map<String, String> properties = new HashMap<>();
        JsonNode props = raw.path("properties");
        if (props.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = props.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                JsonNode v = e.getValue();
                if (v == null || v.isNull() || !v.isValueNode()) continue;
                properties.put(e.getKey(), v.asText());
            }
        }

        return new Entity(id, type, textOf(properties, type), properties);
    }

    static String textOf(Map<String, String> properties, EntityType type) {
        List<String> parts = new ArrayList<>();
        for (String name : type.textProperties()) {
            String v = properties.get(name);
            if (v == null) continue;
            v = v.trim();
            if (!v.isEmpty()) parts.add(v);
        }
        return String.join(" ", parts);
    }
}
