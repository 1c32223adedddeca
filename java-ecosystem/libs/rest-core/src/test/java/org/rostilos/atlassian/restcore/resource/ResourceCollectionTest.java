package org.rostilos.atlassian.restcore.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.rostilos.atlassian.restcore.ResourceNotFoundException;
import org.rostilos.atlassian.restcore.SchemaMismatchException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResourceCollection")
class ResourceCollectionTest {

    static final class Widget extends ResourceObject {
        Widget(EndpointReference endpoint, JsonNode data) {
            super(endpoint, data, "widget");
        }

        String getId() {
            return data().text("id");
        }

        JsonNode poke() throws IOException {
            return postAt("poke", null);
        }
    }

    static final class Widgets extends ResourceCollection<Widget> {
        Widgets(EndpointReference endpoint) {
            super(endpoint);
        }

        @Override
        protected Widget wrap(EndpointReference itemEndpoint, JsonNode data) {
            return new Widget(itemEndpoint, data);
        }
    }

    private MockWebServer mockWebServer;
    private Widgets widgets;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        AtlassianRestClient client = new AtlassianRestClient(new OkHttpClient(), mockWebServer.url("/").toString());
        widgets = new Widgets(new EndpointReference(client, "widgets"));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Nested
    @DisplayName("get()")
    class Get {

        @Test
        @DisplayName("should bind the item to {collection}/{id}")
        void shouldBindItemEndpoint() throws Exception {
            mockWebServer.enqueue(new MockResponse().setBody("{\"type\": \"widget\", \"id\": 42}"));

            Widget widget = widgets.get("42");

            assertThat(widget.getId()).isEqualTo("42");
            assertThat(widget.getUrl()).isEqualTo(mockWebServer.url("/widgets/42").toString());
            assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/widgets/42");
        }

        @Test
        @DisplayName("should fail with ResourceNotFoundException for an absent id")
        void shouldFailForAbsentId() {
            mockWebServer.enqueue(new MockResponse().setResponseCode(404).setBody("{}"));

            assertThatThrownBy(() -> widgets.get("404")).isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("should fail with SchemaMismatchException for a foreign type")
        void shouldFailForForeignType() {
            mockWebServer.enqueue(new MockResponse().setBody("{\"type\": \"gadget\", \"id\": 1}"));

            assertThatThrownBy(() -> widgets.get("1")).isInstanceOf(SchemaMismatchException.class);
        }

        @Test
        @DisplayName("should issue actions relative to the item URL")
        void shouldIssueActionsRelativeToItem() throws Exception {
            mockWebServer.enqueue(new MockResponse().setBody("{\"type\": \"widget\", \"id\": 5}"));
            mockWebServer.enqueue(new MockResponse().setBody("{}"));

            widgets.get("5").poke();

            mockWebServer.takeRequest();
            RecordedRequest action = mockWebServer.takeRequest();
            assertThat(action.getMethod()).isEqualTo("POST");
            assertThat(action.getPath()).isEqualTo("/widgets/5/poke");
        }
    }

    @Nested
    @DisplayName("each()")
    class Each {

        @Test
        @DisplayName("should yield items of all pages in page order")
        void shouldYieldAllPages() {
            mockWebServer.enqueue(new MockResponse().setBody("{\"values\": ["
                    + "{\"type\": \"widget\", \"id\": 1}, {\"type\": \"widget\", \"id\": 2}],"
                    + " \"next\": \"" + mockWebServer.url("/widgets?page=2") + "\"}"));
            mockWebServer.enqueue(new MockResponse().setBody("{\"values\": [{\"type\": \"widget\", \"id\": 3}]}"));

            List<String> ids = new ArrayList<>();
            widgets.each().forEach(w -> ids.add(w.getId()));

            assertThat(ids).containsExactly("1", "2", "3");
            assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should skip inline error records")
        void shouldSkipErrorRecords() {
            mockWebServer.enqueue(new MockResponse().setBody("{\"values\": ["
                    + "{\"type\": \"widget\", \"id\": 1},"
                    + "{\"errors\": [{\"message\": \"partial failure\"}]}]}"));

            List<Widget> result = new ArrayList<>();
            widgets.each().forEach(result::add);

            assertThat(result).hasSize(1);
            assertThat(result.get(0).getUrl()).endsWith("/widgets/1");
        }

        @Test
        @DisplayName("should forward query and sort on the first request only")
        void shouldForwardQueryAndSortOnFirstRequestOnly() throws Exception {
            mockWebServer.enqueue(new MockResponse().setBody("{\"values\": [{\"type\": \"widget\", \"id\": 1}],"
                    + " \"next\": \"" + mockWebServer.url("/widgets?page=2&cursor=abc") + "\"}"));
            mockWebServer.enqueue(new MockResponse().setBody("{\"values\": []}"));

            widgets.each("state=\"OPEN\"", "-updated_on").forEach(w -> { });

            RecordedRequest first = mockWebServer.takeRequest();
            assertThat(first.getRequestUrl().queryParameter("q")).isEqualTo("state=\"OPEN\"");
            assertThat(first.getRequestUrl().queryParameter("sort")).isEqualTo("-updated_on");
            RecordedRequest second = mockWebServer.takeRequest();
            assertThat(second.getPath()).isEqualTo("/widgets?page=2&cursor=abc");
        }

        @Test
        @DisplayName("should not issue requests until iterated")
        void shouldBeLazy() {
            widgets.each();

            assertThat(mockWebServer.getRequestCount()).isZero();
        }
    }

    @Test
    @DisplayName("isErrorRecord should recognize error shapes")
    void isErrorRecordShouldRecognizeErrorShapes() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(ResourceCollection.isErrorRecord(mapper.readTree("{\"errors\": []}"))).isTrue();
        assertThat(ResourceCollection.isErrorRecord(mapper.readTree("{\"type\": \"error\"}"))).isTrue();
        assertThat(ResourceCollection.isErrorRecord(mapper.readTree("[1]"))).isTrue();
        assertThat(ResourceCollection.isErrorRecord(mapper.readTree("{\"type\": \"widget\"}"))).isFalse();
    }
}
