package org.rostilos.atlassian.restcore.resource;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rostilos.atlassian.restcore.AtlassianApiException;
import org.rostilos.atlassian.restcore.AtlassianRestClient;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PagedIterableTest {

    private MockWebServer mockWebServer;
    private AtlassianRestClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        client = new AtlassianRestClient(new OkHttpClient(), mockWebServer.url("/2.0").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private String page(String next, int... ids) {
        String values = Arrays.stream(ids)
                .mapToObj(id -> "{\"id\": " + id + "}")
                .collect(Collectors.joining(","));
        String nextField = next != null ? ", \"next\": \"" + mockWebServer.url(next) + "\"" : "";
        return "{\"values\": [" + values + "]" + nextField + "}";
    }

    @Test
    void testIteration_FollowsNextLinkAcrossPages() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody(page("/2.0/items?page=2", 1, 2)));
        mockWebServer.enqueue(new MockResponse().setBody(page(null, 3)));

        List<Integer> ids = new ArrayList<>();
        for (JsonNode node : client.getPaged("items", Map.of("pagelen", 2))) {
            ids.add(node.get("id").asInt());
        }

        assertThat(ids).containsExactly(1, 2, 3);
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/2.0/items?pagelen=2");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/2.0/items?page=2");
    }

    @Test
    void testIteration_IsLazy() {
        mockWebServer.enqueue(new MockResponse().setBody(page(null, 1)));

        PagedIterable pages = client.getPaged("items", null);

        assertThat(mockWebServer.getRequestCount()).isZero();
        assertThat(pages.iterator().hasNext()).isTrue();
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void testIteration_RestartsFromFirstPageForEachIterator() {
        mockWebServer.enqueue(new MockResponse().setBody(page(null, 1, 2)));
        mockWebServer.enqueue(new MockResponse().setBody(page(null, 1, 2)));

        PagedIterable pages = client.getPaged("items", null);

        assertThat(pages.stream().count()).isEqualTo(2);
        assertThat(pages.stream().count()).isEqualTo(2);
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    void testIteration_SkipsEmptyIntermediatePages() {
        mockWebServer.enqueue(new MockResponse().setBody(page("/2.0/items?page=2")));
        mockWebServer.enqueue(new MockResponse().setBody(page(null, 7)));

        List<JsonNode> nodes = client.getPaged("items", null).stream().collect(Collectors.toList());

        assertThat(nodes).hasSize(1);
        assertThat(nodes.get(0).get("id").asInt()).isEqualTo(7);
    }

    @Test
    void testIteration_ExhaustedIteratorThrowsNoSuchElement() {
        mockWebServer.enqueue(new MockResponse().setBody(page(null)));

        Iterator<JsonNode> iterator = client.getPaged("items", null).iterator();

        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void testIteration_PropagatesApiErrors() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        Iterator<JsonNode> iterator = client.getPaged("items", null).iterator();

        assertThatThrownBy(iterator::hasNext).isInstanceOf(AtlassianApiException.class);
    }
}
