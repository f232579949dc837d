package io.sd.crmindex.index;

/**
 * Base das falhas do índice e do estado de reindexação.
 */
public class IndexException extends RuntimeException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
