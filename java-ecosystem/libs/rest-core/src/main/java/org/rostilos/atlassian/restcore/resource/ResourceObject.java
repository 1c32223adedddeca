package org.rostilos.atlassian.restcore.resource;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * One fetched (or embedded) document bound to its own endpoint.
 * <p>
 * Accessors only read the cached document. Action methods issue requests relative
 * to {@link #getEndpoint()} and never update the cached snapshot; re-fetch the
 * resource to observe server-side changes.
 */
public abstract class ResourceObject {

    private final EndpointReference endpoint;
    private final TypedDocument data;

    /**
     * @param endpoint     own URL, {@code null} for embedded documents without one
     * @param data         raw document
     * @param expectedType type tag the document must carry when it carries one
     */
    protected ResourceObject(EndpointReference endpoint, JsonNode data, String expectedType) {
        this.endpoint = endpoint;
        this.data = new TypedDocument(data, expectedType);
    }

    public EndpointReference getEndpoint() {
        return endpoint;
    }

    public String getUrl() {
        return endpoint != null ? endpoint.url() : null;
    }

    public JsonNode getRawData() {
        return data.raw();
    }

    protected TypedDocument data() {
        return data;
    }

    protected EndpointReference requireEndpoint() {
        if (endpoint == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no endpoint of its own");
        }
        return endpoint;
    }

    protected JsonNode getAt(String subPath) throws IOException {
        EndpointReference target = requireEndpoint().child(subPath);
        return target.client().get(target.url());
    }

    protected JsonNode postAt(String subPath, Object body) throws IOException {
        EndpointReference target = requireEndpoint().child(subPath);
        return target.client().post(target.url(), body);
    }

    protected JsonNode putAt(String subPath, Object body) throws IOException {
        EndpointReference target = requireEndpoint().child(subPath);
        return target.client().put(target.url(), body);
    }

    protected JsonNode deleteAt(String subPath) throws IOException {
        EndpointReference target = requireEndpoint().child(subPath);
        return target.client().delete(target.url());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + (endpoint != null ? endpoint.url() : data.type()) + ")";
    }
}
