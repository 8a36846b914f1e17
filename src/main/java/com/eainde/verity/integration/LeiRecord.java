package com.eainde.verity.integration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record LeiRecord(
        @JsonProperty("lei")                 String lei,
        @JsonProperty("legalName")           String legalName,
        @JsonProperty("jurisdiction")        String jurisdiction,
        @JsonProperty("registrationStatus")  String registrationStatus,
        @JsonProperty("entityStatus")        String entityStatus,
        @JsonProperty("conformityFlag")      String conformityFlag,
        @JsonProperty("legalAddressCountry") String legalAddressCountry,
        @JsonProperty("lastUpdate")          String lastUpdate
) implements Serializable {

    public boolean lapsed() {
        return "LAPSED".equals(registrationStatus);
    }

    public boolean inactive() {
        return "INACTIVE".equals(entityStatus);
    }

    public boolean nonConforming() {
        return "NON_CONFORMING".equals(conformityFlag);
    }
}
