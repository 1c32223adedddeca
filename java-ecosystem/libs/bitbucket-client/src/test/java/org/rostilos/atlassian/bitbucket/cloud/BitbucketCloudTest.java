package org.rostilos.atlassian.bitbucket.cloud;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rostilos.atlassian.bitbucket.cloud.common.User;
import org.rostilos.atlassian.bitbucket.cloud.pullrequests.PullRequests;
import org.rostilos.atlassian.bitbucket.cloud.repositories.Repository;
import org.rostilos.atlassian.bitbucket.cloud.workspaces.Workspace;
import org.rostilos.atlassian.restcore.AtlassianApiException;
import org.rostilos.atlassian.restcore.AtlassianRestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitbucketCloudTest {

    private MockWebServer mockWebServer;
    private BitbucketCloud bitbucket;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        bitbucket = new BitbucketCloud(new AtlassianRestClient(new OkHttpClient(), mockWebServer.url("/2.0/").toString()));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void testDefaultBaseUrl() {
        BitbucketCloud defaultCloud = new BitbucketCloud(new OkHttpClient());

        assertThat(defaultCloud.getClient().getBaseUrl().toString()).isEqualTo("https://api.bitbucket.org/2.0");
    }

    @Test
    void testPullRequests_NavigatesWithoutRequests() {
        PullRequests pullRequests = bitbucket.pullRequests("ws", "repo");

        assertThat(pullRequests.getUrl()).isEqualTo(mockWebServer.url("/2.0/repositories/ws/repo/pullrequests").toString());
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void testWorkspaceToRepositoryToPullRequests() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody(
                "{\"values\":[{\"type\":\"workspace\",\"slug\":\"ws\",\"name\":\"Workspace\",\"uuid\":\"{w}\",\"is_private\":true}]}"));
        mockWebServer.enqueue(new MockResponse().setBody(
                "{\"values\":[{\"type\":\"repository\",\"slug\":\"repo\",\"full_name\":\"ws/repo\","
                        + "\"mainbranch\":{\"name\":\"main\"},\"created_on\":\"2020-05-06T07:08:09.1+00:00\"}]}"));

        Workspace workspace = bitbucket.workspaces().each().iterator().next();
        Repository repository = workspace.repositories().each().iterator().next();

        assertThat(workspace.getSlug()).isEqualTo("ws");
        assertThat(workspace.isPrivate()).isTrue();
        assertThat(workspace.getUrl()).endsWith("/2.0/workspaces/ws");
        assertThat(repository.getFullName()).isEqualTo("ws/repo");
        assertThat(repository.getMainBranch()).isEqualTo("main");
        assertThat(repository.getCreatedOn().getYear()).isEqualTo(2020);
        assertThat(repository.getUrl()).endsWith("/2.0/repositories/ws/repo");
        assertThat(repository.pullRequests().getUrl()).endsWith("/2.0/repositories/ws/repo/pullrequests");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/2.0/workspaces");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/2.0/repositories/ws");
    }

    @Test
    void testRepositories_GetBySlug() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody("{\"type\":\"repository\",\"slug\":\"repo\",\"name\":\"Repo\"}"));

        Repository repository = bitbucket.repositories("ws").get("repo");

        assertThat(repository.getName()).isEqualTo("Repo");
        assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/2.0/repositories/ws/repo");
    }

    @Test
    void testGetCurrentUser() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody(
                "{\"type\":\"user\",\"account_id\":\"557058:1\",\"nickname\":\"ada\","
                        + "\"links\":{\"avatar\":{\"href\":\"https://avatar/ada\"}}}"));

        User user = bitbucket.getCurrentUser();

        assertThat(user.getAccountId()).isEqualTo("557058:1");
        assertThat(user.getAvatarUrl()).isEqualTo("https://avatar/ada");
    }

    @Test
    void testValidateConnection_Success() throws Exception {
        mockWebServer.enqueue(new MockResponse().setBody("{\"type\":\"user\"}"));

        assertThat(bitbucket.validateConnection()).isTrue();
    }

    @Test
    void testValidateConnection_Unauthorized() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401));

        assertThat(bitbucket.validateConnection()).isFalse();
    }

    @Test
    void testValidateConnection_ServerErrorPropagates() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> bitbucket.validateConnection())
                .isInstanceOf(AtlassianApiException.class);
    }
}
