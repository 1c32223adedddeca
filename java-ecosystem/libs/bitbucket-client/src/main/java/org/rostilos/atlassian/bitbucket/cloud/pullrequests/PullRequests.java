package org.rostilos.atlassian.bitbucket.cloud.pullrequests;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.bitbucket.cloud.dto.request.CreatePullRequestRequest;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pull requests of one repository, at {@code /repositories/{workspace}/{repo_slug}/pullrequests}.
 * <p>
 * {@link #each(String, String)} takes a Bitbucket query such as {@code state="MERGED"};
 * without one the server only returns open pull requests.
 */
public class PullRequests extends ResourceCollection<PullRequest> {

    private static final Logger log = LoggerFactory.getLogger(PullRequests.class);

    public PullRequests(EndpointReference endpoint) {
        super(endpoint);
    }

    @Override
    protected PullRequest wrap(EndpointReference itemEndpoint, JsonNode data) {
        return new PullRequest(itemEndpoint, data);
    }

    public PullRequest get(int id) throws IOException {
        return get(String.valueOf(id));
    }

    /**
     * Opens a new pull request.
     *
     * @param reviewers account UUIDs, may be {@code null}
     */
    public PullRequest create(String title, String sourceBranch, String destinationBranch,
                              String description, Boolean closeSourceBranch,
                              List<String> reviewers) throws IOException {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Pull request title cannot be null or empty");
        }
        if (sourceBranch == null || sourceBranch.isBlank()) {
            throw new IllegalArgumentException("Source branch cannot be null or empty");
        }
        CreatePullRequestRequest request = new CreatePullRequestRequest(
                title,
                CreatePullRequestRequest.BranchRef.of(sourceBranch),
                destinationBranch != null ? CreatePullRequestRequest.BranchRef.of(destinationBranch) : null,
                description,
                closeSourceBranch,
                reviewers != null
                        ? reviewers.stream().map(CreatePullRequestRequest.ReviewerRef::new).collect(Collectors.toList())
                        : null);

        log.info("Creating pull request '{}' from {} in {}", title, sourceBranch, getUrl());
        JsonNode created = getEndpoint().client().post(getUrl(), request);
        return wrap(getEndpoint().child(itemId(created)), created);
    }
}
