package io.sd.crmindex.source;

import io.sd.crmindex.model.EntityType;

/**
 * Falha ao ler uma página da fonte CRM.
 */
public abstract class CrmSourceException extends Exception {

    private final EntityType type;

    protected CrmSourceException(EntityType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public EntityType getType() {
        return type;
    }

    /** Se vale a pena repetir o mesmo pedido. */
    public abstract boolean isRetryable();
}
