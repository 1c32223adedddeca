package org.rostilos.atlassian.restcore.resource;

import okhttp3.HttpUrl;
import org.rostilos.atlassian.restcore.AtlassianRestClient;

import java.util.Objects;

/**
 * Absolute URL plus the client (session, auth) needed to issue requests against it.
 * Immutable; navigation produces new references.
 */
public final class EndpointReference {

    private final AtlassianRestClient client;
    private final String url;

    public EndpointReference(AtlassianRestClient client, String url) {
        this.client = Objects.requireNonNull(client, "client");
        this.url = client.resolve(url).toString();
    }

    public AtlassianRestClient client() {
        return client;
    }

    public String url() {
        return url;
    }

    /**
     * Appends path segments, each one URL-encoded.
     */
    public EndpointReference child(String... segments) {
        HttpUrl.Builder builder = HttpUrl.get(url).newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return new EndpointReference(client, builder.build().toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EndpointReference)) return false;
        return url.equals(((EndpointReference) o).url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return url;
    }
}
