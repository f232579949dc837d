package io.sd.crmindex.cache;

import io.sd.crmindex.index.IndexGeneration;
import io.sd.crmindex.reindex.RebuildSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Geração publicada e resumo do último reindex. O único escritor é o orquestrador (single-flight);
 * os leitores veem sempre a geração antiga ou a nova inteira.
 */
public class CacheState {

    private static final Logger log = LoggerFactory.getLogger(CacheState.class);

    private final AtomicReference<IndexGeneration> published = new AtomicReference<>();
    private final AtomicReference<RebuildSummary> lastJob = new AtomicReference<>();

    public Optional<IndexGeneration> current() {
        return Optional.ofNullable(published.get());
    }

    public void publish(IndexGeneration generation) {
        if (generation == null) {
            throw new IllegalArgumentException("geração nula");
        }
        IndexGeneration previous = published.getAndSet(generation);
        log.info("Geração {} publicada ({} entidades), substitui {}",
                generation.generation(), generation.size(),
                previous == null ? "nenhuma" : previous.generation());
    }

    public boolean isInitialized() {
        return published.get() != null;
    }

    public Optional<RebuildSummary> lastJobSummary() {
        return Optional.ofNullable(lastJob.get());
    }

    public void recordJob(RebuildSummary summary) {
        lastJob.set(summary);
    }
}
