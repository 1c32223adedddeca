package org.rostilos.atlassian.bitbucket.cloud;

import okhttp3.OkHttpClient;
import org.rostilos.atlassian.bitbucket.cloud.common.User;
import org.rostilos.atlassian.bitbucket.cloud.pullrequests.PullRequests;
import org.rostilos.atlassian.bitbucket.cloud.repositories.WorkspaceRepositories;
import org.rostilos.atlassian.bitbucket.cloud.workspaces.Workspaces;
import org.rostilos.atlassian.restcore.AtlassianApiException;
import org.rostilos.atlassian.restcore.AtlassianRestClient;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Entry point into the Bitbucket Cloud 2.0 API.
 * Navigation methods are local; requests are only issued by fetches, enumerations and actions.
 */
public class BitbucketCloud {
    private static final Logger log = LoggerFactory.getLogger(BitbucketCloud.class);

    private final AtlassianRestClient client;

    public BitbucketCloud(OkHttpClient authorizedOkHttpClient) {
        this(new AtlassianRestClient(authorizedOkHttpClient, BitbucketCloudConfig.BITBUCKET_API_BASE));
    }

    public BitbucketCloud(AtlassianRestClient client) {
        this.client = client;
    }

    public AtlassianRestClient getClient() {
        return client;
    }

    public Workspaces workspaces() {
        return new Workspaces(new EndpointReference(client, "workspaces"));
    }

    public WorkspaceRepositories repositories(String workspace) {
        return new WorkspaceRepositories(new EndpointReference(client, "repositories").child(workspace));
    }

    /**
     * Pull requests of a repository without fetching the repository first.
     */
    public PullRequests pullRequests(String workspace, String repoSlug) {
        return new PullRequests(new EndpointReference(client, "repositories")
                .child(workspace, repoSlug, "pullrequests"));
    }

    public User getCurrentUser() throws IOException {
        EndpointReference endpoint = new EndpointReference(client, "user");
        return new User(endpoint, client.get(endpoint.url()));
    }

    /**
     * @return {@code false} when the credentials are rejected
     */
    public boolean validateConnection() throws IOException {
        try {
            client.get("user");
            return true;
        } catch (AtlassianApiException e) {
            if (e.isUnauthorized() || e.isForbidden()) {
                log.warn("Bitbucket Cloud rejected the credentials: HTTP {}", e.getStatusCode());
                return false;
            }
            throw e;
        }
    }
}
