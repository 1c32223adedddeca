package org.rostilos.atlassian.restcore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import okhttp3.*;
import org.rostilos.atlassian.restcore.resource.PagedIterable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Thin request primitive shared by every Atlassian client.
 * Authentication is expected to be applied by interceptors of the supplied {@link OkHttpClient}.
 */
public class AtlassianRestClient {

    private static final Logger log = LoggerFactory.getLogger(AtlassianRestClient.class);
    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM_MEDIA_TYPE = MediaType.get("application/octet-stream");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;

    public AtlassianRestClient(OkHttpClient httpClient, String baseUrl) {
        this(httpClient, new ObjectMapper(), baseUrl);
    }

    public AtlassianRestClient(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL cannot be null or empty");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(baseUrl);
    }

    public HttpUrl getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Resolves a path against the base URL. Absolute URLs are returned unchanged.
     */
    public HttpUrl resolve(String path) {
        if (path == null || path.isEmpty()) {
            return baseUrl;
        }
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return HttpUrl.get(path);
        }
        String base = baseUrl.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String relative = path;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return HttpUrl.get(base + "/" + relative);
    }

    /**
     * Percent-encodes a value for use as exactly one path segment, so that ids containing
     * {@code /}, {@code ?} or {@code #} stay inside their segment.
     */
    public static String encodeSegment(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Path segment cannot be null");
        }
        return new HttpUrl.Builder()
                .scheme("https")
                .host("localhost")
                .addPathSegment(String.valueOf(value))
                .build()
                .encodedPathSegments()
                .get(0);
    }

    // ========== JSON verbs ==========

    public JsonNode get(String path) throws IOException {
        return get(path, null, null);
    }

    public JsonNode get(String path, Map<String, ?> params) throws IOException {
        return get(path, params, null);
    }

    public JsonNode get(String path, Map<String, ?> params, Map<String, String> headers) throws IOException {
        return execute("GET", withParams(resolve(path), params), null, headers);
    }

    public JsonNode post(String path, Object body) throws IOException {
        return post(path, body, null);
    }

    public JsonNode post(String path, Object body, Map<String, String> headers) throws IOException {
        return execute("POST", resolve(path), jsonBody(body, true), headers);
    }

    public JsonNode put(String path, Object body) throws IOException {
        return put(path, body, null);
    }

    public JsonNode put(String path, Object body, Map<String, String> headers) throws IOException {
        return execute("PUT", resolve(path), jsonBody(body, true), headers);
    }

    public JsonNode delete(String path) throws IOException {
        return delete(path, null, null);
    }

    public JsonNode delete(String path, Object body) throws IOException {
        return delete(path, body, null);
    }

    public JsonNode delete(String path, Object body, Map<String, String> headers) throws IOException {
        return execute("DELETE", resolve(path), jsonBody(body, false), headers);
    }

    /**
     * Submits one file as a multipart form part.
     */
    public JsonNode upload(String path, String fieldName, Path file, Map<String, String> headers) throws IOException {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart(fieldName, file.getFileName().toString(),
                        RequestBody.create(file.toFile(), OCTET_STREAM_MEDIA_TYPE))
                .build();
        return execute("POST", resolve(path), body, headers);
    }

    /**
     * Issues a GET and returns a single response header, e.g. an upload token.
     */
    public String header(String path, String headerName, Map<String, String> headers) throws IOException {
        HttpUrl url = resolve(path);
        Request request = newRequest("GET", url, null, headers);
        log.debug("GET {} (header {})", url, headerName);

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("GET " + url, response.code(), readBody(response));
            }
            return response.header(headerName);
        }
    }

    /**
     * Lazy enumeration of a Bitbucket style paged endpoint ({@code values} + {@code next}).
     * Parameters only apply to the first page; continuation URLs are followed as returned.
     */
    public PagedIterable getPaged(String path, Map<String, ?> params) {
        return new PagedIterable(this, withParams(resolve(path), params).toString());
    }

    // ========== Helper Methods ==========

    private JsonNode execute(String method, HttpUrl url, RequestBody body, Map<String, String> headers) throws IOException {
        Request request = newRequest(method, url, body, headers);
        log.debug("{} {}", method, url);

        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = readBody(response);
            if (!response.isSuccessful()) {
                throw createException(method + " " + url, response.code(), responseBody);
            }
            if (responseBody.isBlank()) {
                return NullNode.getInstance();
            }
            return objectMapper.readTree(responseBody);
        }
    }

    private Request newRequest(String method, HttpUrl url, RequestBody body, Map<String, String> headers) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/json");
        if (headers != null) {
            headers.forEach(builder::header);
        }
        return builder.method(method, body).build();
    }

    private RequestBody jsonBody(Object body, boolean required) throws JsonProcessingException {
        if (body == null) {
            return required ? RequestBody.create(new byte[0], (MediaType) null) : null;
        }
        String json = body instanceof String ? (String) body : objectMapper.writeValueAsString(body);
        return RequestBody.create(json, JSON_MEDIA_TYPE);
    }

    private HttpUrl withParams(HttpUrl url, Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return url;
        }
        HttpUrl.Builder builder = url.newBuilder();
        params.forEach((key, value) -> {
            if (value != null) {
                builder.addQueryParameter(key, String.valueOf(value));
            }
        });
        return builder.build();
    }

    private String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private AtlassianApiException createException(String operation, int statusCode, String body) {
        String serverMessage = extractErrorMessage(body);
        log.warn("Atlassian API returned {} for {}: {}", statusCode, operation,
                serverMessage != null ? serverMessage : body);
        if (statusCode == 404) {
            return new ResourceNotFoundException(operation, body, serverMessage);
        }
        return new AtlassianApiException(operation, statusCode, body, serverMessage);
    }

    /**
     * Service Desk reports {@code errorMessage}, Bitbucket {@code error.message},
     * Jira core {@code errorMessages[]}.
     */
    String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Error response is not JSON: {}", e.getOriginalMessage());
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }
        if (root.hasNonNull("errorMessage")) {
            return root.get("errorMessage").asText();
        }
        JsonNode error = root.path("error");
        if (error.hasNonNull("message")) {
            return error.get("message").asText();
        }
        if (root.hasNonNull("message")) {
            return root.get("message").asText();
        }
        JsonNode messages = root.path("errorMessages");
        if (messages.isArray() && !messages.isEmpty()) {
            return messages.get(0).asText();
        }
        return null;
    }
}
