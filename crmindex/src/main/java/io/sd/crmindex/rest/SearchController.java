package io.sd.crmindex.rest;

import io.sd.crmindex.model.EntityType;
import io.sd.crmindex.search.SearchService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/search")
public class SearchController {

    private final SearchService searchService;
    private final int defaultTopK;
    private final double defaultThreshold;

    public SearchController(SearchService searchService,
                            @Value("${index.default-top-k:5}") int defaultTopK,
                            @Value("${index.default-threshold:0.0}") double defaultThreshold) {
        this.searchService = searchService;
        this.defaultTopK = defaultTopK;
        this.defaultThreshold = defaultThreshold;
    }

    public record SearchResponseItem(String id, EntityType type, String text, double score,
                                     Map<String, String> properties) { }

    @GetMapping
    public List<SearchResponseItem> search(
            @RequestParam("q") String query,
            @RequestParam(name = "top_k", required = false) Integer topK,
            @RequestParam(name = "types", required = false) List<String> types,
            @RequestParam(name = "threshold", required = false) Double threshold
    ) {
        int k = topK == null ? defaultTopK : topK;
        double min = threshold == null ? defaultThreshold : threshold;

        var hits = searchService.search(query, k, parseTypes(types), min);
        return hits.stream()
                .map(h -> new SearchResponseItem(h.entity().id(), h.entity().type(), h.entity().text(),
                        h.score(), h.entity().properties()))
                .toList();
    }

    static Set<EntityType> parseTypes(List<String> raw) {
        if (raw == null || raw.isEmpty()) return Set.of();
        Set<EntityType> out = EnumSet.noneOf(EntityType.class);
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            out.add(EntityType.fromObjectPath(s.trim()));
        }
        return out;
    }
}
