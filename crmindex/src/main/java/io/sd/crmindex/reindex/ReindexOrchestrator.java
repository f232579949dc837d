package io.sd.crmindex.reindex;

import io.sd.crmindex.cache.CacheState;
import io.sd.crmindex.emb.CachingEmbeddingFunction;
import io.sd.crmindex.emb.EmbeddingException;
import io.sd.crmindex.emb.EmbeddingFunction;
import io.sd.crmindex.index.DimensionMismatchException;
import io.sd.crmindex.index.IndexGeneration;
import io.sd.crmindex.index.IndexStats;
import io.sd.crmindex.index.VectorIndexStore;
import io.sd.crmindex.model.EmbeddedEntity;
import io.sd.crmindex.model.Entity;
import io.sd.crmindex.model.EntityType;
import io.sd.crmindex.normalize.EntityNormalizer;
import io.sd.crmindex.normalize.MalformedRecordException;
import io.sd.crmindex.source.CrmPage;
import io.sd.crmindex.source.CrmSource;
import io.sd.crmindex.source.CrmSourceException;
import io.sd.crmindex.source.PermanentSourceException;
import io.sd.crmindex.source.TransientSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Limpa e reconstrói o índice: CLEARING → LOADING → EMBEDDING → BUILDING → PUBLISHING → DONE.
 *
 * <p>Um só job ativo de cada vez; pedidos concorrentes são rejeitados, não ficam em fila.
 * Cada tipo de entidade corre numa tarefa própria (carga seguida de embedding) e falha de forma
 * independente; o job passa a EMBEDDING quando o primeiro tipo acaba de carregar; o job só
 * falha se nenhum tipo chegar ao fim, ou se a construção do índice falhar. A geração publicada
 * só muda no passo PUBLISHING.
 */
public class ReindexOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReindexOrchestrator.class);

    private final CrmSource source;
    private final EntityNormalizer normalizer;
    private final EmbeddingFunction embeddings;
    private final VectorIndexStore store;
    private final CacheState cacheState;
    private final ExecutorService workers;
    private final ReindexOptions options;
    private final Clock clock;

    private final AtomicReference<RebuildJob> active = new AtomicReference<>();

    public ReindexOrchestrator(CrmSource source,
                               EntityNormalizer normalizer,
                               EmbeddingFunction embeddings,
                               VectorIndexStore store,
                               CacheState cacheState,
                               ExecutorService workers,
                               ReindexOptions options,
                               Clock clock) {
        this.source = source;
        this.normalizer = normalizer;
        this.embeddings = embeddings;
        this.store = store;
        this.cacheState = cacheState;
        this.workers = workers;
        this.options = options;
        this.clock = clock;
    }

    /**
     * Executa um reindex completo na thread de quem chama.
     *
     * @throws RebuildInProgressException se já houver um job ativo
     */
    public RebuildSummary triggerReindex() {
        RebuildJob job = new RebuildJob(clock.instant());
        if (!active.compareAndSet(null, job)) {
            RebuildJob running = active.get();
            throw new RebuildInProgressException(running == null ? "?" : running.id());
        }

        log.info("Reindex {} iniciado", job.id());
        RebuildSummary summary;
        try {
            try {
                run(job);
            } catch (RuntimeException e) {
                log.error("Reindex {} abortado", job.id(), e);
                if (!job.state().isTerminal()) job.fail("Erro inesperado: " + e);
            }
            // o resumo fica arquivado antes de o job deixar de estar ativo
            summary = job.snapshot(clock.instant());
            cacheState.recordJob(summary);
        } finally {
            active.set(null);
        }

        log.info("Reindex {} terminou em {}: carregados={}, indexados={}",
                job.id(), summary.state(), summary.totalLoaded(), summary.totalEmbedded());
        return summary;
    }

    public Optional<RebuildSummary> activeJob() {
        RebuildJob job = active.get();
        return job == null ? Optional.empty() : Optional.of(job.snapshot(null));
    }

    public boolean isRunning() {
        return active.get() != null;
    }

    private void run(RebuildJob job) {
        long deadline = System.nanoTime() + options.timeout().toNanos();

        // 1) limpar: nada do job anterior é reaproveitado
        job.transition(RebuildState.CLEARING);
        source.refresh();
        if (embeddings instanceof CachingEmbeddingFunction cache) {
            int dropped = cache.size();
            cache.invalidateAll();
            job.log("Cache de embeddings limpa ({} entradas)", dropped);
        }

        // 2) carregar e embeddar: uma tarefa por tipo, sem barreira entre as duas fases
        job.transition(RebuildState.LOADING);
        Map<EntityType, LoadResult> loads = new ConcurrentHashMap<>();
        Map<EntityType, Future<EmbedResult>> pipelines = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            submit(job, type, pipelines, () -> pipeline(job, type, loads));
        }

        // 3) único ponto de junção, pela ordem declarada dos tipos
        List<EmbeddedEntity> merged = new ArrayList<>();
        int loadedTypes = 0;
        int succeeded = 0;
        for (Map.Entry<EntityType, Future<EmbedResult>> e : pipelines.entrySet()) {
            EntityType type = e.getKey();
            EmbedResult r = null;
            String failure = null;
            try {
                r = await(e.getValue(), deadline);
            } catch (TypeFailure f) {
                failure = f.getMessage();
            }

            LoadResult load = loads.get(type);
            if (load == null) {
                markFailed(job, type, "carga", failure);
                continue;
            }
            loadedTypes++;
            job.logAll(load.log());
            job.outcome(job.outcome(type).loaded(load.entities().size(), load.skipped()));
            job.log("{}: {} carregados, {} ignorados", type.objectPath(), load.entities().size(), load.skipped());

            if (r == null) {
                markFailed(job, type, "embedding", failure);
                continue;
            }
            job.logAll(r.log());
            job.outcome(job.outcome(type).embedded(r.embedded().size()));
            merged.addAll(r.embedded());
            succeeded++;
            job.log("{}: {} embeddings", type.objectPath(), r.embedded().size());
        }
        if (loadedTypes == 0) {
            job.fail("Nenhum tipo de entidade foi carregado");
            return;
        }
        if (succeeded == 0) {
            job.fail("Nenhum tipo de entidade chegou ao fim do embedding");
            return;
        }

        // 4) construir a nova geração
        job.transition(RebuildState.BUILDING);
        IndexGeneration generation;
        try {
            generation = store.build(merged);
        } catch (DimensionMismatchException e) {
            job.fail("Dimensões inconsistentes entre vetores: " + e.getMessage());
            return;
        }
        job.log("Geração {} construída com {} entidades", generation.generation(), generation.size());

        // 5) publicar: troca atómica da referência
        job.transition(RebuildState.PUBLISHING);
        cacheState.publish(generation);
        IndexStats stats = store.stats(generation);
        job.published(stats);

        job.transition(RebuildState.DONE);
    }

    private <T> void submit(RebuildJob job, EntityType type, Map<EntityType, Future<T>> futures,
                            Callable<T> task) {
        try {
            futures.put(type, workers.submit(task));
        } catch (RejectedExecutionException e) {
            markFailed(job, type, "agendamento", "tarefa rejeitada pelo executor");
        }
    }

    private void markFailed(RebuildJob job, EntityType type, String phase, String reason) {
        job.outcome(job.outcome(type).failed(reason));
        job.log("{}: falhou na {} - {}", type.objectPath(), phase, reason);
        log.warn("Reindex: {} falhou na {}: {}", type.objectPath(), phase, reason);
    }

    /** Espera pelo resultado até ao prazo do job; no fim do prazo a tarefa é cancelada. */
    private static <T> T await(Future<T> future, long deadline) throws TypeFailure {
        try {
            if (future.isDone()) {
                return future.get();
            }
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                future.cancel(true);
                throw new TypeFailure("timeout do reindex");
            }
            return future.get(left, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TypeFailure("timeout do reindex");
        } catch (CancellationException e) {
            throw new TypeFailure("cancelado");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new TypeFailure(describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TypeFailure("interrompido");
        }
    }

    private static String describe(Throwable t) {
        if (t instanceof CrmSourceException || t instanceof EmbeddingException) {
            return t.getMessage();
        }
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    // ---------------------------------------------------------------- tarefas por tipo

    private EmbedResult pipeline(RebuildJob job, EntityType type, Map<EntityType, LoadResult> loads)
            throws CrmSourceException, EmbeddingException, InterruptedException {
        LoadResult load = loadType(type);
        loads.put(type, load);
        job.embeddingStarted();
        return embedType(type, load.entities());
    }

    private LoadResult loadType(EntityType type) throws CrmSourceException, InterruptedException {
        Map<String, Entity> byId = new LinkedHashMap<>();
        List<String> lines = new ArrayList<>();
        int skipped = 0;
        int duplicates = 0;
        int pages = 0;
        int max = options.maxEntitiesPerType();
        String cursor = null;

        while (true) {
            checkInterrupted();
            CrmPage page = fetchWithRetry(type, cursor, lines);
            pages++;

            for (var raw : page.records()) {
                if (max > 0 && byId.size() >= max) break;
                try {
                    Entity entity = normalizer.normalize(raw, type);
                    // ids repetidos: fica a última versão vista
                    if (byId.put(entity.id(), entity) != null) {
                        skipped++;
                        duplicates++;
                    }
                } catch (MalformedRecordException e) {
                    skipped++;
                    log.warn("{}: registo ignorado - {}", type.objectPath(), e.getMessage());
                }
            }

            if (max > 0 && byId.size() >= max) {
                lines.add(type.objectPath() + ": limite de " + max + " entidades atingido");
                break;
            }
            if (!page.hasNext()) break;
            if (page.nextCursor().equals(cursor)) {
                throw new PermanentSourceException(type, "Cursor repetido na paginação: " + cursor);
            }
            cursor = page.nextCursor();
        }

        if (duplicates > 0) {
            lines.add(type.objectPath() + ": " + duplicates + " registos com id repetido");
            log.warn("{}: {} registos com id repetido ignorados", type.objectPath(), duplicates);
        }
        log.debug("{}: {} páginas, {} entidades", type.objectPath(), pages, byId.size());
        return new LoadResult(new ArrayList<>(byId.values()), skipped, lines);
    }

    private CrmPage fetchWithRetry(EntityType type, String cursor, List<String> lines)
            throws CrmSourceException, InterruptedException {
        RetryPolicy retry = options.retry();
        for (int attempt = 1; ; attempt++) {
            checkInterrupted();
            try {
                return source.list(type, cursor);
            } catch (TransientSourceException e) {
                if (attempt >= retry.maxAttempts()) {
                    throw e;
                }
                long waitMs = retry.delay(attempt - 1).toMillis();
                lines.add(type.objectPath() + ": erro transitório (tentativa " + attempt + "), nova tentativa em "
                        + waitMs + "ms");
                log.warn("{}: erro transitório na tentativa {}/{}: {}", type.objectPath(), attempt,
                        retry.maxAttempts(), e.getMessage());
                if (waitMs > 0) Thread.sleep(waitMs);
            }
        }
    }

    private EmbedResult embedType(EntityType type, List<Entity> entities)
            throws EmbeddingException, InterruptedException {
        List<Entity> withText = new ArrayList<>();
        for (Entity e : entities) {
            if (e.hasText()) withText.add(e);
        }

        List<String> lines = new ArrayList<>();
        if (withText.size() < entities.size()) {
            lines.add(type.objectPath() + ": " + (entities.size() - withText.size()) + " sem texto, não indexados");
        }

        List<EmbeddedEntity> out = new ArrayList<>(withText.size());
        int batch = options.batchSize();
        for (int from = 0; from < withText.size(); from += batch) {
            checkInterrupted();
            List<Entity> slice = withText.subList(from, Math.min(from + batch, withText.size()));
            List<String> texts = slice.stream().map(Entity::text).toList();

            List<float[]> vectors = embeddings.embed(texts);
            if (vectors == null || vectors.size() != texts.size()) {
                throw new EmbeddingException("Modelo devolveu " + (vectors == null ? 0 : vectors.size())
                        + " vetores para " + texts.size() + " textos");
            }
            for (int i = 0; i < slice.size(); i++) {
                out.add(new EmbeddedEntity(slice.get(i), vectors.get(i)));
            }
        }
        return new EmbedResult(out, lines);
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("reindex cancelado");
        }
    }

    private record LoadResult(List<Entity> entities, int skipped, List<String> log) { }

    private record EmbedResult(List<EmbeddedEntity> embedded, List<String> log) { }

    private static final class TypeFailure extends Exception {
        TypeFailure(String message) {
            super(message, null, false, false);
        }
    }
}
