package org.rostilos.atlassian.restcore.resource;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.function.BiFunction;

/**
 * A related resource the local document only links to.
 * {@link #getHref()} is local; {@link #fetch()} issues one GET.
 *
 * @param <T> decoded resource type
 */
public final class FetchableReference<T> {

    private final EndpointReference target;
    private final BiFunction<EndpointReference, JsonNode, T> decoder;

    public FetchableReference(EndpointReference target, BiFunction<EndpointReference, JsonNode, T> decoder) {
        this.target = target;
        this.decoder = decoder;
    }

    public String getHref() {
        return target.url();
    }

    public T fetch() throws IOException {
        JsonNode data = target.client().get(target.url());
        return decoder.apply(target, data);
    }

    @Override
    public String toString() {
        return "FetchableReference(" + target.url() + ")";
    }
}
