package io.sd.crmindex.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Uma página de registos em bruto. {@code nextCursor == null} indica a última página.
 */
public record CrmPage(List<JsonNode> records, String nextCursor) {

    public CrmPage {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean hasNext() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
