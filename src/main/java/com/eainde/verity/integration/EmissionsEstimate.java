package com.eainde.verity.integration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * GLEC freight emissions estimate for one logistics leg.
 *
 * @param co2eKg           CO2 equivalent in kilograms
 * @param co2eTonnes       CO2 equivalent in tonnes
 * @param factorId         emission factor id used
 * @param source           emission factor source
 * @param transportMode    sea / road / rail / air / barge
 * @param origin           origin location or port code
 * @param destination      destination location or port code
 * @param compliant        whether the calculation is GLEC-compliant
 * @param estimated        true when computed locally instead of by the remote service
 */
public record EmissionsEstimate(
        @JsonProperty("co2eKg")        double co2eKg,
        @JsonProperty("co2eTonnes")    double co2eTonnes,
        @JsonProperty("factorId")      String factorId,
        @JsonProperty("source")        String source,
        @JsonProperty("transportMode") String transportMode,
        @JsonProperty("origin")        String origin,
        @JsonProperty("destination")   String destination,
        @JsonProperty("compliant")     boolean compliant,
        @JsonProperty("estimated")     boolean estimated
) implements Serializable {
}
