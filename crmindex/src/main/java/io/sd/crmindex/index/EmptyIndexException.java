package io.sd.crmindex.index;

public class EmptyIndexException extends IndexException {

    public EmptyIndexException(String message) {
        super(message);
    }
}
