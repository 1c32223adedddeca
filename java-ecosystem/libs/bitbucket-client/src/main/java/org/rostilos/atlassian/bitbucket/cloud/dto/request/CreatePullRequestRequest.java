package org.rostilos.atlassian.bitbucket.cloud.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Body of {@code POST /repositories/{workspace}/{repo_slug}/pullrequests}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "source", "destination", "description", "close_source_branch", "reviewers"})
public record CreatePullRequestRequest(
        @JsonProperty("title") String title,
        @JsonProperty("source") BranchRef source,
        @JsonProperty("destination") BranchRef destination,
        @JsonProperty("description") String description,
        @JsonProperty("close_source_branch") Boolean closeSourceBranch,
        @JsonProperty("reviewers") List<ReviewerRef> reviewers
) {
    public record BranchRef(@JsonProperty("branch") BranchName branch) {
        public static BranchRef of(String name) {
            return new BranchRef(new BranchName(name));
        }
    }

    public record BranchName(@JsonProperty("name") String name) {
    }

    public record ReviewerRef(@JsonProperty("uuid") String uuid) {
    }
}
