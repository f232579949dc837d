package io.sd.crmindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Tipos de entidade CRM indexados, pela ordem em que o reindex os processa.
 */
public enum EntityType {

    CONTACT("contacts", List.of("firstname", "lastname", "email", "jobtitle", "company", "phone")),
    COMPANY("companies", List.of("name", "domain", "industry", "description", "city", "country")),
    DEAL("deals", List.of("dealname", "dealstage", "pipeline", "closedate", "amount"));

    private final String objectPath;
    private final List<String> textProperties;

    EntityType(String objectPath, List<String> textProperties) {
        this.objectPath = objectPath;
        this.textProperties = textProperties;
    }

    /** Nome do objeto na API CRM (ex: "contacts"). */
    @JsonValue
    public String objectPath() {
        return objectPath;
    }

    /** Propriedades que entram no texto do embedding, por esta ordem. */
    public List<String> textProperties() {
        return textProperties;
    }

    @JsonCreator
    public static EntityType fromObjectPath(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Tipo de entidade em falta");
        }
        for (EntityType t : values()) {
            if (t.objectPath.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Tipo de entidade desconhecido: " + value);
    }
}
