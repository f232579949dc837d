package io.sd.crmindex.reindex;

import io.sd.crmindex.model.EntityType;

/**
 * Resultado de um tipo de entidade numa execução de reindex.
 *
 * @param skippedCount registos ignorados por não terem id ou por repetirem um id já carregado
 */
public record TypeOutcome(
        EntityType type,
        boolean attempted,
        int loadedCount,
        int skippedCount,
        int embeddedCount,
        boolean succeeded,
        String error
) {

    static TypeOutcome notAttempted(EntityType type) {
        return new TypeOutcome(type, false, 0, 0, 0, false, null);
    }

    TypeOutcome loaded(int loaded, int skipped) {
        return new TypeOutcome(type, true, loaded, skipped, embeddedCount, false, null);
    }

    TypeOutcome embedded(int embedded) {
        return new TypeOutcome(type, true, loadedCount, skippedCount, embedded, true, null);
    }

    TypeOutcome failed(String reason) {
        return new TypeOutcome(type, true, loadedCount, skippedCount, 0, false, reason);
    }
}
