package com.eainde.verity.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.util.Map;

/**
 * Climatiq freight estimate. Any failure falls back to {@link GlecFallback}; this client never throws.
 */
@Log4j2
public class ClimatiqEmissionsClient implements EmissionsClient {

    private static final Map<String, String> ACTIVITY_IDS = Map.of(
            "sea", "freight_vessel-vessel_type_container_ship-route_type_na-size_na",
            "road", "freight_vehicle-vehicle_type_hgv-fuel_source_diesel-vehicle_weight_gt_33t-percentage_load_na",
            "rail", "freight_train-route_type_domestic-fuel_source_na",
            "air", "freight_flight-route_type_na-distance_na-weight_na-rf_included");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public ClimatiqEmissionsClient(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public EmissionsEstimate estimate(String origin, String destination, double weightKg, String mode) {
        String transportMode = mode == null ? "sea" : mode.toLowerCase();
        String activityId = ACTIVITY_IDS.getOrDefault(transportMode, ACTIVITY_IDS.get("sea"));
        double distanceKm = GlecFallback.routeDistanceKm(origin, destination, transportMode);
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("No Climatiq API key configured. Using GLEC fallback for {} -> {}", origin, destination);
            return GlecFallback.estimate(origin, destination, weightKg, transportMode, distanceKm);
        }

        Map<String, Object> payload = Map.of(
                "emission_factor", Map.of("activity_id", activityId, "data_version", "^6"),
                "parameters", Map.of(
                        "weight", weightKg / 1000.0,
                        "weight_unit", "t",
                        "distance", distanceKm,
                        "distance_unit", "km"));

        Request request = new Request.Builder()
                .url(HttpUrl.get(baseUrl).newBuilder().addPathSegment("estimate").build())
                .header("Authorization", "Bearer " + apiKey)
                .post(JsonHttp.body(objectMapper, payload))
                .build();

        try {
            JsonNode data = JsonHttp.execute(httpClient, request, objectMapper);
            JsonNode co2e = data.path("co2e");
            if (!co2e.isNumber()) {
                throw new MalformedResponseException("Climatiq response carries no numeric co2e");
            }
            double co2eKg = co2e.asDouble();
            JsonNode factor = data.path("emission_factor");
            return new EmissionsEstimate(
                    GlecFallback.round(co2eKg, 2),
                    GlecFallback.round(co2eKg / 1000.0, 4),
                    factor.path("id").asText(""),
                    factor.path("source").asText("Climatiq"),
                    transportMode,
                    origin,
                    destination,
                    true,
                    false);
        } catch (CollaboratorException e) {
            log.warn("Climatiq unavailable ({}). Using GLEC fallback for {} -> {}", e.getMessage(), origin, destination);
            return GlecFallback.estimate(origin, destination, weightKg, transportMode, distanceKm);
        }
    }
}
