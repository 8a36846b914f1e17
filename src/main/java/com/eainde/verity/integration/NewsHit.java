package com.eainde.verity.integration;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record NewsHit(
        @JsonProperty("title")          String title,
        @JsonProperty("snippet")        String snippet,
        @JsonProperty("url")            String url,
        @JsonProperty("source")         String source,
        @JsonProperty("publishedDate")  String publishedDate,
        @JsonProperty("relevanceScore") double relevanceScore
) implements Serializable {
}
