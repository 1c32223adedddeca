package org.rostilos.atlassian.restcore.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Handle over "many items of one type" at a collection URL.
 * Holds no cached state: every lookup and every enumeration is a fresh request.
 *
 * @param <T> wrapped item type
 */
public abstract class ResourceCollection<T extends ResourceObject> {

    private static final Logger log = LoggerFactory.getLogger(ResourceCollection.class);

    private final EndpointReference endpoint;

    protected ResourceCollection(EndpointReference endpoint) {
        this.endpoint = endpoint;
    }

    public EndpointReference getEndpoint() {
        return endpoint;
    }

    public String getUrl() {
        return endpoint.url();
    }

    /**
     * Wraps one raw item bound to its own endpoint.
     */
    protected abstract T wrap(EndpointReference itemEndpoint, JsonNode data);

    /**
     * Path segment addressing one item below the collection URL.
     */
    protected String itemId(JsonNode data) {
        return data.path("id").asText();
    }

    /**
     * Fetches {@code {collection}/{id}}.
     *
     * @throws org.rostilos.atlassian.restcore.ResourceNotFoundException when the server reports the item absent
     */
    public T get(String id) throws IOException {
        EndpointReference itemEndpoint = endpoint.child(id);
        JsonNode data = endpoint.client().get(itemEndpoint.url());
        return wrap(itemEndpoint, data);
    }

    public Iterable<T> each() {
        return each(null, null);
    }

    /**
     * Lazy enumeration of the whole collection. Each iteration starts from the first page.
     * Inline error records are skipped.
     *
     * @param query filter expression, forwarded as {@code q}
     * @param sort  property to sort by, forwarded as {@code sort}
     */
    public Iterable<T> each(String query, String sort) {
        Map<String, String> params = new LinkedHashMap<>();
        if (sort != null) {
            params.put("sort", sort);
        }
        if (query != null) {
            params.put("q", query);
        }
        PagedIterable pages = endpoint.client().getPaged(endpoint.url(), params);
        return () -> wrapAll(pages.iterator());
    }

    private Iterator<T> wrapAll(Iterator<JsonNode> records) {
        return new Iterator<>() {
            private T pending;

            @Override
            public boolean hasNext() {
                while (pending == null && records.hasNext()) {
                    JsonNode data = records.next();
                    if (isErrorRecord(data)) {
                        log.warn("Skipping error record in {}: {}", endpoint.url(), data);
                        continue;
                    }
                    pending = wrap(endpoint.child(itemId(data)), data);
                }
                return pending != null;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T item = pending;
                pending = null;
                return item;
            }
        };
    }

    static boolean isErrorRecord(JsonNode data) {
        return data == null
                || !data.isObject()
                || data.has("errors")
                || "error".equals(data.path(TypedDocument.TYPE_FIELD).asText());
    }
}
