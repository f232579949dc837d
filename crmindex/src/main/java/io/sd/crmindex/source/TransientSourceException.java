package io.sd.crmindex.source;

import io.sd.crmindex.model.EntityType;

/** Rate limit, erro 5xx ou falha de rede: repete-se com backoff. */
public class TransientSourceException extends CrmSourceException {

    public TransientSourceException(EntityType type, String message) {
        this(type, message, null);
    }

    public TransientSourceException(EntityType type, String message, Throwable cause) {
        super(type, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
