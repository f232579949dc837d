package io.sd.crmindex.emb;

import java.util.List;

/**
 * Texto → vetor de dimensão fixa. A saída tem o mesmo tamanho e a mesma ordem da entrada.
 */
public interface EmbeddingFunction {

    List<float[]> embed(List<String> texts) throws EmbeddingException;

    String modelName();
}
