package io.sd.crmindex.reindex;

public enum RebuildState {
    IDLE,
    CLEARING,
    LOADING,
    EMBEDDING,
    BUILDING,
    PUBLISHING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
