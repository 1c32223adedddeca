package org.rostilos.atlassian.bitbucket.cloud.pullrequests;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.rostilos.atlassian.restcore.resource.EndpointReference;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommentTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockWebServer;
    private PullRequest pullRequest;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        AtlassianRestClient client = new AtlassianRestClient(new OkHttpClient(), mockWebServer.url("/2.0/").toString());
        pullRequest = new PullRequest(new EndpointReference(client, "repositories/ws/repo/pullrequests/7"),
                objectMapper.readTree("{\"type\":\"pullrequest\",\"id\":7,\"state\":\"OPEN\"}"));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void testComments_EnumeratesNestedCollection() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody("{\"values\":["
                + "{\"type\":\"pullrequest_comment\",\"id\":1,\"content\":{\"raw\":\"first\"},\"deleted\":false,"
                + "\"user\":{\"type\":\"user\",\"nickname\":\"ada\"},\"created_on\":\"2021-01-02T03:04:05.000000+00:00\"},"
                + "{\"type\":\"pullrequest_comment\",\"id\":2,\"content\":{\"raw\":\"\"},\"deleted\":true}]}"));

        List<Comment> comments = new ArrayList<>();
        pullRequest.comments().each().forEach(comments::add);

        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/2.0/repositories/ws/repo/pullrequests/7/comments");
        assertThat(comments).hasSize(2);
        assertThat(comments.get(0).getRaw()).isEqualTo("first");
        assertThat(comments.get(0).getUser().getNickname()).isEqualTo("ada");
        assertThat(comments.get(0).getCreatedOn().getYear()).isEqualTo(2021);
        assertThat(comments.get(1).isDeleted()).isTrue();
        assertThat(comments.get(1).getUrl()).endsWith("/pullrequests/7/comments/2");
    }

    @Test
    void testUpdate_PutsNewContent() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody(
                "{\"type\":\"pullrequest_comment\",\"id\":99,\"content\":{\"raw\":\"lgtm\"}}"));
        mockWebServer.enqueue(new MockResponse().setBody(
                "{\"type\":\"pullrequest_comment\",\"id\":99,\"content\":{\"raw\":\"lgtm!\"}}"));
        Comment comment = pullRequest.comment("lgtm");
        mockWebServer.takeRequest();

        Comment updated = comment.update("lgtm!");

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/2.0/repositories/ws/repo/pullrequests/7/comments/99");
        assertThat(objectMapper.readTree(request.getBody().readUtf8()))
                .isEqualTo(objectMapper.readTree("{\"content\":{\"raw\":\"lgtm!\"}}"));
        assertThat(updated.getRaw()).isEqualTo("lgtm!");
        assertThat(comment.getRaw()).isEqualTo("lgtm");
    }

    @Test
    void testDelete() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody(
                "{\"type\":\"pullrequest_comment\",\"id\":99,\"content\":{\"raw\":\"lgtm\"}}"));
        mockWebServer.enqueue(new MockResponse().setResponseCode(204));
        Comment comment = pullRequest.comment("lgtm");
        mockWebServer.takeRequest();

        comment.delete();

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("DELETE");
        assertThat(request.getPath()).isEqualTo("/2.0/repositories/ws/repo/pullrequests/7/comments/99");
    }

    @Test
    void testUpdate_RejectsEmptyText() throws Exception {
        Comment embedded = new Comment(null, objectMapper.readTree("{\"type\":\"pullrequest_comment\",\"id\":1}"));

        assertThatThrownBy(() -> embedded.update("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> embedded.update("x")).isInstanceOf(IllegalStateException.class);
    }
}
