package io.sd.crmindex.reindex;

import io.sd.crmindex.index.IndexStats;

import java.time.Instant;
import java.util.List;

/**
 * Fotografia de um reindex. Para um job ativo, {@code finishedAt} e {@code index} são nulos.
 *
 * @param index estatísticas da geração publicada por este job, se houve publicação
 */
public record RebuildSummary(
        String jobId,
        RebuildState state,
        Instant startedAt,
        Instant finishedAt,
        List<TypeOutcome> outcomes,
        int totalLoaded,
        int totalEmbedded,
        String error,
        List<String> log,
        IndexStats index
) {

    public RebuildSummary {
        outcomes = List.copyOf(outcomes);
        log = List.copyOf(log);
    }

    public long succeededTypes() {
        return outcomes.stream().filter(TypeOutcome::succeeded).count();
    }
}
