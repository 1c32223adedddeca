package org.rostilos.atlassian.restcore.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Records of a paged endpoint, fetched one page at a time.
 * <p>
 * Every call to {@link #iterator()} starts again from the first page; an iterator
 * cannot be resumed once abandoned. Iterators are not thread-safe.
 */
public class PagedIterable implements Iterable<JsonNode> {

    private static final Logger log = LoggerFactory.getLogger(PagedIterable.class);

    static final String VALUES_FIELD = "values";
    static final String NEXT_FIELD = "next";

    private final AtlassianRestClient client;
    private final String firstPageUrl;

    public PagedIterable(AtlassianRestClient client, String firstPageUrl) {
        this.client = client;
        this.firstPageUrl = firstPageUrl;
    }

    @Override
    public Iterator<JsonNode> iterator() {
        return new PageIterator();
    }

    public Stream<JsonNode> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private final class PageIterator implements Iterator<JsonNode> {
        private String nextUrl = firstPageUrl;
        private Iterator<JsonNode> batch = Collections.emptyIterator();

        @Override
        public boolean hasNext() {
            while (!batch.hasNext() && nextUrl != null) {
                fetchPage();
            }
            return batch.hasNext();
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return batch.next();
        }

        private void fetchPage() {
            String url = nextUrl;
            JsonNode page;
            try {
                page = client.get(url);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to fetch page " + url, e);
            }

            JsonNode values = page.path(VALUES_FIELD);
            batch = values.isArray() ? values.elements() : Collections.emptyIterator();

            JsonNode next = page.path(NEXT_FIELD);
            nextUrl = next.isTextual() && !next.asText().isEmpty() ? next.asText() : null;
            log.debug("Fetched page {} ({} records, more: {})", url, values.size(), nextUrl != null);
        }
    }
}
