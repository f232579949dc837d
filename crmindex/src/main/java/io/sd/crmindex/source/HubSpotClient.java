package io.sd.crmindex.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sd.crmindex.model.EntityType;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cliente da API CRM v3 do HubSpot ({@code /crm/v3/objects/{tipo}}), paginado por cursor {@code after}.
 *
 * <p>Cada pedido pede as propriedades de texto do tipo, as propriedades extra configuradas e, com a
 * descoberta ativa, todas as propriedades que {@code /crm/v3/properties/{tipo}} devolve (menos as de
 * sistema e as calculadas). As propriedades descobertas ficam guardadas até {@link #refresh()}.
 */
public class HubSpotClient implements CrmSource {

    private static final Logger log = LoggerFactory.getLogger(HubSpotClient.class);

    /** Incluídas sempre pela API ou que não podem ser pedidas. */
    static final Set<String> SYSTEM_PROPERTIES = Set.of(
            "id", "createddate", "lastmodifieddate", "createdate", "hs_lastmodifieddate", "hs_object_id",
            "hs_created_by", "hs_updated_by", "archived", "archivedAt");

    private final String apiBase;
    private final String apiKey;
    private final int pageSize;
    private final List<String> extraProperties;
    private final boolean discoverProperties;
    private final ObjectMapper mapper;
    private final OkHttpClient http;

    private final Map<EntityType, List<String>> discovered = new ConcurrentHashMap<>();

    public HubSpotClient(String apiBase, String apiKey, int pageSize,
                         Duration connectTimeout, Duration readTimeout, Duration callTimeout,
                         List<String> extraProperties, boolean discoverProperties, ObjectMapper mapper) {
        String base = apiBase == null ? "" : apiBase.trim();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        this.apiBase = base;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.pageSize = Math.max(1, Math.min(pageSize, 100)); // limite da API
        this.extraProperties = extraProperties == null ? List.of() : List.copyOf(extraProperties);
        this.discoverProperties = discoverProperties;
        this.mapper = mapper;
        // callTimeout limita o pedido inteiro: uma leitura bloqueada não reage a interrupções
        this.http = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .callTimeout(callTimeout)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Override
    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    @Override
    public void refresh() {
        discovered.clear();
    }

    @Override
    public CrmPage list(EntityType type, String cursor) throws CrmSourceException {
        if (!isConfigured()) {
            throw new PermanentSourceException(type, "HUBSPOT_API_KEY não configurada");
        }

        HttpUrl.Builder url = url(type, "/crm/v3/objects/" + type.objectPath())
                .addQueryParameter("limit", String.valueOf(pageSize))
                .addQueryParameter("properties", String.join(",", requestedProperties(type)))
                .addQueryParameter("archived", "false");
        if (cursor != null && !cursor.isBlank()) {
            url.addQueryParameter("after", cursor);
        }

        return parsePage(type, get(type, url.build()));
    }

    /** Propriedades de texto, extra e descobertas, sem repetidos e por esta ordem. */
    List<String> requestedProperties(EntityType type) {
        Set<String> names = new LinkedHashSet<>(type.textProperties());
        names.addAll(extraProperties);
        if (discoverProperties) {
            List<String> found = discovered.get(type);
            if (found == null) {
                found = discover(type);
                if (found != null) discovered.put(type, found);
            }
            if (found != null) names.addAll(found);
        }
        return new ArrayList<>(names);
    }

    private List<String> discover(EntityType type) {
        try {
            JsonNode root = readObject(type, get(type, url(type, "/crm/v3/properties/" + type.objectPath()).build()));
            List<String> names = new ArrayList<>();
            for (JsonNode p : root.path("results")) {
                String name = p.path("name").asText("");
                if (name.isEmpty() || SYSTEM_PROPERTIES.contains(name)) continue;
                if (p.path("calculated").asBoolean(false)) continue;
                names.add(name);
            }
            log.info("HubSpot {}: {} propriedades descobertas", type.objectPath(), names.size());
            return List.copyOf(names);
        } catch (CrmSourceException e) {
            // sem cache: a próxima página volta a tentar
            log.warn("HubSpot {}: descoberta de propriedades falhou, uso só as configuradas: {}",
                    type.objectPath(), e.getMessage());
            return null;
        }
    }

    private HttpUrl.Builder url(EntityType type, String path) throws PermanentSourceException {
        HttpUrl url = HttpUrl.parse(apiBase + path);
        if (url == null) {
            throw new PermanentSourceException(type, "URL base inválida: " + apiBase);
        }
        return url.newBuilder();
    }

    private String get(EntityType type, HttpUrl url) throws CrmSourceException {
        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response resp = http.newCall(request).execute()) {
            int code = resp.code();
            String body = readAll(resp.body());

            if (code == 429 || code >= 500) {
                throw new TransientSourceException(type,
                        "HubSpot " + url.encodedPath() + " falhou (" + code + "): " + abbreviate(body));
            }
            if (!resp.isSuccessful()) {
                throw new PermanentSourceException(type,
                        "HubSpot " + url.encodedPath() + " falhou (" + code + "): " + abbreviate(body));
            }
            return body;
        } catch (IOException e) {
            throw new TransientSourceException(type,
                    "Erro de rede a ler " + url.encodedPath() + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readObject(EntityType type, String body) throws PermanentSourceException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new PermanentSourceException(type, "Resposta ilegível para " + type.objectPath(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PermanentSourceException(type, "Resposta inesperada para " + type.objectPath());
        }
        return root;
    }

    private CrmPage parsePage(EntityType type, String body) throws PermanentSourceException {
        JsonNode root = readObject(type, body);

        List<JsonNode> records = new ArrayList<>();
        JsonNode results = root.path("results");
        if (results.isArray()) {
            results.forEach(records::add);
        }

        String next = root.path("paging").path("next").path("after").asText(null);
        if (next != null && next.isBlank()) next = null;

        log.debug("HubSpot {}: {} registos, next={}", type.objectPath(), records.size(), next);
        return new CrmPage(records, next);
    }

    private static String readAll(ResponseBody body) throws IOException {
        return body == null ? "" : body.string();
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 300 ? s : s.substring(0, 300) + "...";
    }
}
