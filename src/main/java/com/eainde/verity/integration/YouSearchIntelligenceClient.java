package com.eainde.verity.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * You.com web search scanned for environmental and ethical risk keywords.
 */
@Log4j2
public class YouSearchIntelligenceClient implements IntelligenceClient {

    static final List<String> RISK_KEYWORDS = List.of(
            "environmental violation",
            "pollution",
            "fine",
            "penalty",
            "greenwashing",
            "deforestation",
            "illegal logging",
            "toxic waste",
            "emissions scandal",
            "port strike",
            "supply chain disruption",
            "regulatory action",
            "sanctions",
            "forced labor",
            "child labor",
            "human rights violation",
            "carbon fraud",
            "certificate revoked");

    private static final int MAX_HITS = 10;
    private static final int MAX_SNIPPET = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Clock clock;

    public YouSearchIntelligenceClient(OkHttpClient httpClient, ObjectMapper objectMapper,
                                       String baseUrl, String apiKey, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.clock = clock;
    }

    @Override
    public SupplierIntelligence search(String supplierId, String name, String context) {
        String query = name + " environmental compliance sustainability"
                + (context == null || context.isBlank() ? "" : " " + context);

        Request request = new Request.Builder()
                .url(HttpUrl.get(baseUrl).newBuilder()
                        .addPathSegment("search")
                        .addQueryParameter("query", query)
                        .build())
                .header("X-API-Key", apiKey)
                .get()
                .build();
        JsonNode data = JsonHttp.execute(httpClient, request, objectMapper);

        List<NewsHit> hits = new ArrayList<>();
        Set<String> keywords = new LinkedHashSet<>();
        for (JsonNode hit : data.path("hits")) {
            if (hits.size() == MAX_HITS) {
                break;
            }
            String title = hit.path("title").asText("");
            String snippet = hit.has("description") ? hit.path("description").asText("") : hit.path("snippet").asText("");
            String text = (title + " " + snippet).toLowerCase(Locale.ROOT);
            List<String> found = RISK_KEYWORDS.stream().filter(text::contains).toList();
            keywords.addAll(found);
            double relevance = found.isEmpty() ? 0.1 : Math.min(found.size() * 0.2, 1.0);
            hits.add(new NewsHit(
                    title,
                    snippet.length() > MAX_SNIPPET ? snippet.substring(0, MAX_SNIPPET) : snippet,
                    hit.path("url").asText(""),
                    hit.path("source").asText(""),
                    hit.path("published_date").isMissingNode() || hit.path("published_date").isNull()
                            ? null : hit.path("published_date").asText(),
                    relevance));
        }

        List<String> distinct = new ArrayList<>(keywords);
        RiskTier tier = RiskTier.fromKeywordCount(distinct.size());
        log.debug("Intelligence for {}: {} hits, {} risk keywords, tier {}", supplierId, hits.size(), distinct.size(), tier);
        return new SupplierIntelligence(supplierId, query, clock.instant(), tier, hits, distinct,
                summarize(hits, distinct), true);
    }

    static String summarize(List<NewsHit> hits, List<String> keywords) {
        if (hits.isEmpty()) {
            return "No relevant news found for this supplier.";
        }
        String head = "Found " + hits.size() + " relevant news items.";
        if (keywords.isEmpty()) {
            return head + " No immediate risk indicators found in recent news.";
        }
        return head + " Risk indicators detected: " + String.join(", ", keywords.subList(0, Math.min(5, keywords.size()))) + ".";
    }
}
