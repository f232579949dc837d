package io.sd.crmindex.normalize;

import io.sd.crmindex.index.IndexException;

/**
 * Registo CRM sem identificador utilizável. O registo é ignorado, o tipo continua.
 */
public class MalformedRecordException extends IndexException {

    public MalformedRecordException(String message) {
        super(message);
    }
}
