package io.sd.crmindex.emb;

import ai.djl.Application;
import ai.djl.ModelException;
import ai.djl.huggingface.translator.TextEmbeddingTranslatorFactory;
import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ModelZoo;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.training.util.ProgressBar;
import ai.djl.translate.TranslateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Embeddings locais via DJL (sentence-transformers). O {@link Predictor} não é thread-safe,
 * por isso o acesso é serializado.
 */
public class EmbeddingService implements EmbeddingFunction, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final String modelName;
    private final ZooModel<String, float[]> model;
    private final Predictor<String, float[]> predictor;

    public EmbeddingService(String modelName, String modelUrl) throws ModelException {
        this.modelName = modelName;
        try {
            Criteria<String, float[]> criteria = Criteria.<String, float[]>builder()
                    .optApplication(Application.NLP.TEXT_EMBEDDING)
                    .setTypes(String.class, float[].class)
                    .optModelUrls(modelUrl)
                    .optTranslatorFactory(new TextEmbeddingTranslatorFactory())
                    .optProgress(new ProgressBar())
                    .build();

            this.model = ModelZoo.loadModel(criteria);
            this.predictor = model.newPredictor();
        } catch (Exception e) {
            throw new ModelException("Falha a carregar modelo DJL " + modelUrl, e);
        }
        log.info("Modelo de embeddings carregado: {}", modelName);
    }

    @Override
    public synchronized List<float[]> embed(List<String> texts) throws EmbeddingException {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            return predictor.batchPredict(texts);
        } catch (TranslateException e) {
            throw new EmbeddingException("Falha a gerar embeddings para " + texts.size() + " textos", e);
        }
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public void close() {
        predictor.close();
        model.close();
    }
}
