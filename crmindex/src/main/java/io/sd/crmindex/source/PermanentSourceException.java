package io.sd.crmindex.source;

import io.sd.crmindex.model.EntityType;

/** Erro que não se resolve repetindo (credenciais, 4xx, resposta ilegível). Falha o tipo. */
public class PermanentSourceException extends CrmSourceException {

    public PermanentSourceException(EntityType type, String message) {
        this(type, message, null);
    }

    public PermanentSourceException(EntityType type, String message, Throwable cause) {
        super(type, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
