package io.sd.crmindex.index;

import java.time.Instant;
import java.util.Map;

/**
 * @param countsByType entidades por tipo, com a chave no formato da API CRM ("contacts", ...)
 */
public record IndexStats(
        long totalEntities,
        int dimension,
        String indexKind,
        String modelName,
        Instant builtAt,
        long generation,
        Map<String, Integer> countsByType
) { }
