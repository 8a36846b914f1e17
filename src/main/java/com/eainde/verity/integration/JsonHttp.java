package com.eainde.verity.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * Blocking JSON-over-HTTP call shared by the REST collaborators.
 */
final class JsonHttp {

    static final MediaType JSON = MediaType.get("application/json");

    private JsonHttp() {
    }

    static RequestBody body(ObjectMapper objectMapper, Object payload) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
    }

    /**
     * Executes the request and parses the body.
     *
     * @throws CollaboratorException on I/O failure or a non-2xx status
     * @throws MalformedResponseException when the body is not JSON
     */
    static JsonNode execute(OkHttpClient client, Request request, ObjectMapper objectMapper) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw new CollaboratorException(
                        request.url().host() + " returned HTTP " + response.code() + ": " + abbreviate(text));
            }
            try {
                return objectMapper.readTree(text.isBlank() ? "{}" : text);
            } catch (JsonProcessingException e) {
                throw new MalformedResponseException(request.url().host() + " returned a non-JSON body", e);
            }
        } catch (IOException e) {
            throw new CollaboratorException(request.url().host() + " unreachable: " + e.getMessage(), e);
        }
    }

    static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
