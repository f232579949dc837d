package io.sd.crmindex.reindex;

import io.sd.crmindex.index.IndexStats;
import io.sd.crmindex.model.EntityType;
import org.slf4j.helpers.MessageFormatter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Estado de um reindex em curso. A thread do orquestrador faz as transições e regista os resultados;
 * as tarefas por tipo só chamam {@link #embeddingStarted}. {@link #snapshot} pode ser chamado de
 * qualquer thread.
 */
final class RebuildJob {

    private final String id = UUID.randomUUID().toString();
    private final Instant startedAt;

    private RebuildState state = RebuildState.IDLE;
    private final Map<EntityType, TypeOutcome> outcomes = new EnumMap<>(EntityType.class);
    private final List<String> log = new ArrayList<>();
    private String error;
    private IndexStats index;

    RebuildJob(Instant startedAt) {
        this.startedAt = startedAt;
        for (EntityType t : EntityType.values()) {
            outcomes.put(t, TypeOutcome.notAttempted(t));
        }
    }

    String id() {
        return id;
    }

    synchronized RebuildState state() {
        return state;
    }

    synchronized void transition(RebuildState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Job " + id + " já terminou em " + state);
        }
        state = next;
        log.add("[" + next + "]");
    }

    /**
     * O primeiro tipo a terminar a carga passa o job de LOADING a EMBEDDING. A marca fica logo a seguir a
     * "[LOADING]", seja qual for o tipo que chega primeiro.
     */
    synchronized void embeddingStarted() {
        if (state != RebuildState.LOADING) return;
        state = RebuildState.EMBEDDING;
        int at = log.lastIndexOf("[" + RebuildState.LOADING + "]");
        log.add(at + 1, "[" + RebuildState.EMBEDDING + "]");
    }

    synchronized void log(String format, Object... args) {
        log.add(MessageFormatter.arrayFormat(format, args).getMessage());
    }

    synchronized void logAll(List<String> lines) {
        log.addAll(lines);
    }

    synchronized TypeOutcome outcome(EntityType type) {
        return outcomes.get(type);
    }

    synchronized void outcome(TypeOutcome outcome) {
        outcomes.put(outcome.type(), outcome);
    }

    synchronized void fail(String reason) {
        this.error = reason;
        transition(RebuildState.FAILED);
    }

    synchronized void published(IndexStats stats) {
        this.index = stats;
    }

    synchronized RebuildSummary snapshot(Instant finishedAt) {
        List<TypeOutcome> ordered = new ArrayList<>(outcomes.values());
        int loaded = 0;
        int embedded = 0;
        for (TypeOutcome o : ordered) {
            loaded += o.loadedCount();
            if (o.succeeded()) embedded += o.embeddedCount();
        }
        return new RebuildSummary(id, state, startedAt, finishedAt, ordered, loaded, embedded, error,
                log, index);
    }
}
