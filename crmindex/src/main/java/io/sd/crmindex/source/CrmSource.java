package io.sd.crmindex.source;

import io.sd.crmindex.model.EntityType;

/**
 * Fonte paginada de registos CRM por tipo.
 */
public interface CrmSource {

    /**
     * @param cursor {@code null} para a primeira página
     */
    CrmPage list(EntityType type, String cursor) throws CrmSourceException;

    /** Esquece o que a fonte guardou entre chamadas (ex: propriedades descobertas). */
    default void refresh() {
    }

    /** Se a fonte tem o necessário (credenciais) para responder. */
    default boolean isConfigured() {
        return true;
    }
}
