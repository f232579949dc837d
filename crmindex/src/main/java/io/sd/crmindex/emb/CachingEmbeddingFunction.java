package io.sd.crmindex.emb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache LRU de embeddings indexada pelo SHA-256 do texto. Só os textos em falta vão ao modelo.
 */
public class CachingEmbeddingFunction implements EmbeddingFunction {

    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingFunction.class);

    private final EmbeddingFunction delegate;
    private final Map<String, float[]> cache;

    public CachingEmbeddingFunction(EmbeddingFunction delegate, int maxEntries) {
        this.delegate = delegate;
        int max = Math.max(1, maxEntries);
        this.cache = new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, float[]> eldest) {
                return size() > max;
            }
        };
    }

    @Override
    public List<float[]> embed(List<String> texts) throws EmbeddingException {
        int n = texts.size();
        float[][] out = new float[n][];
        String[] keys = new String[n];

        List<String> missing = new ArrayList<>();
        List<Integer> missingPos = new ArrayList<>();

        synchronized (cache) {
            for (int i = 0; i < n; i++) {
                keys[i] = sha256Hex(texts.get(i));
                float[] hit = cache.get(keys[i]);
                if (hit != null) {
                    out[i] = hit;
                } else {
                    missing.add(texts.get(i));
                    missingPos.add(i);
                }
            }
        }

        if (!missing.isEmpty()) {
            List<float[]> fresh = delegate.embed(missing);
            if (fresh == null || fresh.size() != missing.size()) {
                throw new EmbeddingException("Modelo devolveu " + (fresh == null ? 0 : fresh.size())
                        + " vetores para " + missing.size() + " textos");
            }
            synchronized (cache) {
                for (int j = 0; j < fresh.size(); j++) {
                    int pos = missingPos.get(j);
                    out[pos] = fresh.get(j);
                    cache.put(keys[pos], fresh.get(j));
                }
            }
            log.debug("Embeddings: {} em cache, {} gerados", n - missing.size(), missing.size());
        }

        List<float[]> result = new ArrayList<>(n);
        for (float[] v : out) result.add(v.clone());
        return result;
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    public void invalidateAll() {
        synchronized (cache) {
            cache.clear();
        }
    }

    public int size() {
        synchronized (cache) {
            return cache.size();
        }
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest((s == null ? "" : s).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponível", e);
        }
    }
}
