package com.eainde.verity.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * GLEIF LEI lookup. Exact legal-name search first, full-text search when that finds nothing.
 */
@Log4j2
public class GleifRegistryClient implements EntityRegistryClient {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public GleifRegistryClient(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    @Override
    public EntityVerification verify(String supplierId, String name, String jurisdiction) {
        HttpUrl.Builder url = recordsUrl()
                .addQueryParameter("filter[entity.legalName]", name)
                .addQueryParameter("page[size]", "5");
        if (jurisdiction != null && !jurisdiction.isBlank()) {
            url.addQueryParameter("filter[entity.legalAddress.country]", jurisdiction.toUpperCase());
        }

        JsonNode data = get(url.build()).path("data");
        if (!data.isArray() || data.isEmpty()) {
            log.debug("No exact LEI match for '{}', retrying with full-text search", name);
            return fuzzySearch(supplierId, name);
        }

        List<LeiRecord> records = new ArrayList<>();
        Set<String> flags = new LinkedHashSet<>();
        for (JsonNode item : data) {
            LeiRecord record = toRecord(item);
            records.add(record);
            if (record.lapsed()) {
                flags.add("LEI_REGISTRATION_LAPSED");
            }
            if (record.inactive()) {
                flags.add("ENTITY_INACTIVE");
            }
            if (record.nonConforming()) {
                flags.add("NON_CONFORMING_LEI");
            }
        }

        RegistryStatus status;
        if (records.stream().anyMatch(LeiRecord::lapsed)) {
            status = RegistryStatus.LAPSED;
        } else if (!flags.isEmpty()) {
            status = RegistryStatus.FLAGGED;
        } else {
            status = RegistryStatus.VERIFIED;
        }
        return new EntityVerification(supplierId, name, status, records, new ArrayList<>(flags), true);
    }

    private EntityVerification fuzzySearch(String supplierId, String name) {
        HttpUrl url = recordsUrl()
                .addQueryParameter("filter[fulltext]", name)
                .addQueryParameter("page[size]", "3")
                .build();
        JsonNode data = get(url).path("data");
        if (!data.isArray() || data.isEmpty()) {
            return new EntityVerification(supplierId, name, RegistryStatus.NO_LEI_FOUND, List.of(),
                    List.of("NO_LEI_REGISTRATION", "FUZZY_SEARCH_NO_MATCH"), true);
        }
        LeiRecord best = toRecord(data.get(0));
        RegistryStatus status = "ACTIVE".equals(best.entityStatus()) ? RegistryStatus.VERIFIED : RegistryStatus.FLAGGED;
        return new EntityVerification(supplierId, name, status, List.of(best), List.of("FUZZY_MATCH_ONLY"), true);
    }

    private LeiRecord toRecord(JsonNode item) {
        JsonNode attributes = item.path("attributes");
        JsonNode entity = attributes.path("entity");
        JsonNode registration = attributes.path("registration");
        JsonNode legalName = entity.path("legalName");
        return new LeiRecord(
                item.path("id").asText(attributes.path("lei").asText("")),
                legalName.isObject() ? legalName.path("name").asText("") : legalName.asText(""),
                entity.path("jurisdiction").asText(""),
                registration.path("status").asText("UNKNOWN"),
                entity.path("status").asText("ACTIVE"),
                registration.path("conformityFlag").asText(""),
                entity.path("legalAddress").path("country").asText(""),
                registration.path("lastUpdateDate").asText(""));
    }

    private HttpUrl.Builder recordsUrl() {
        return HttpUrl.get(baseUrl).newBuilder().addPathSegment("lei-records");
    }

    private JsonNode get(HttpUrl url) {
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.api+json")
                .get()
                .build();
        return JsonHttp.execute(httpClient, request, objectMapper);
    }
}
