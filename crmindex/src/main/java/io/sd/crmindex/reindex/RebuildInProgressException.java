package io.sd.crmindex.reindex;

import io.sd.crmindex.index.IndexException;

public class RebuildInProgressException extends IndexException {

    private final String activeJobId;

    public RebuildInProgressException(String activeJobId) {
        super("Reindex já em curso (job " + activeJobId + ")");
        this.activeJobId = activeJobId;
    }

    public String getActiveJobId() {
        return activeJobId;
    }
}
