package io.sd.crmindex.config;

import ai.djl.ModelException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sd.crmindex.cache.CacheState;
import io.sd.crmindex.emb.CachingEmbeddingFunction;
import io.sd.crmindex.emb.EmbeddingFunction;
import io.sd.crmindex.emb.EmbeddingService;
import io.sd.crmindex.index.VectorIndexStore;
import io.sd.crmindex.model.EntityType;
import io.sd.crmindex.normalize.EntityNormalizer;
import io.sd.crmindex.reindex.RebuildInProgressException;
import io.sd.crmindex.reindex.ReindexOrchestrator;
import io.sd.crmindex.search.SearchService;
import io.sd.crmindex.source.CrmSource;
import io.sd.crmindex.source.HubSpotClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties({IndexProperties.class, HubSpotProperties.class})
public class IndexConfig {

    private static final Logger log = LoggerFactory.getLogger(IndexConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    CrmSource crmSource(HubSpotProperties props, ObjectMapper om) {
        HubSpotClient client = new HubSpotClient(props.baseUrl(), props.apiKey(), props.pageSize(),
                props.connectTimeout(), props.readTimeout(), props.callTimeout(),
                props.extraProperties(), props.discoverProperties(), om);
        if (!client.isConfigured()) {
            log.warn("HUBSPOT_API_KEY não definida - o reindex vai falhar em todos os tipos");
        }
        return client;
    }

    /** Modelo local DJL. Com {@code index.embedding-provider} diferente de djl, outro bean com este nome tem de existir. */
    @Bean(name = "modelEmbeddingFunction")
    @ConditionalOnProperty(name = "index.embedding-provider", havingValue = "djl", matchIfMissing = true)
    EmbeddingService modelEmbeddingFunction(IndexProperties props) throws ModelException {
        return new EmbeddingService(props.modelName(), props.modelUrl());
    }

    @Bean
    @Primary
    CachingEmbeddingFunction embeddingFunction(@Qualifier("modelEmbeddingFunction") EmbeddingFunction model,
                                               IndexProperties props) {
        return new CachingEmbeddingFunction(model, props.embeddingCacheSize());
    }

    @Bean
    VectorIndexStore vectorIndexStore(EmbeddingFunction embeddingFunction, Clock clock) {
        return new VectorIndexStore(embeddingFunction.modelName(), clock);
    }

    @Bean
    CacheState cacheState() {
        return new CacheState();
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService reindexWorkers() {
        return Executors.newFixedThreadPool(EntityType.values().length, new CustomizableThreadFactory("reindex-"));
    }

    @Bean
    ReindexOrchestrator reindexOrchestrator(CrmSource source,
                                            EntityNormalizer normalizer,
                                            EmbeddingFunction embeddingFunction,
                                            VectorIndexStore store,
                                            CacheState cacheState,
                                            @Qualifier("reindexWorkers") ExecutorService workers,
                                            IndexProperties props,
                                            Clock clock) {
        return new ReindexOrchestrator(source, normalizer, embeddingFunction, store, cacheState, workers,
                props.toReindexOptions(), clock);
    }

    @Bean
    SearchService searchService(CacheState cacheState, VectorIndexStore store, EmbeddingFunction embeddingFunction) {
        return new SearchService(cacheState, store, embeddingFunction);
    }

    @Bean
    @ConditionalOnProperty(name = "index.rebuild-on-startup", havingValue = "true")
    ApplicationRunner rebuildOnStartup(ReindexOrchestrator orchestrator) {
        return args -> {
            Thread t = new Thread(() -> {
                try {
                    orchestrator.triggerReindex();
                } catch (RebuildInProgressException e) {
                    log.info("Reindex inicial ignorado: {}", e.getMessage());
                }
            }, "reindex-startup");
            t.setDaemon(true);
            t.start();
        };
    }

    @Bean
    ApplicationRunner logIndexConfig(IndexProperties props, EmbeddingFunction embeddingFunction) {
        return args -> log.info("Índice CRM: modelo={}, batch={}, max/tipo={}, timeout={}",
                embeddingFunction.modelName(), props.batchSize(), props.maxEntitiesPerType(),
                props.rebuildTimeout());
    }
}
