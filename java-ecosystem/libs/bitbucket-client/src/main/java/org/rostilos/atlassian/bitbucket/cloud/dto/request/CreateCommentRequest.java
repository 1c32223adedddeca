package org.rostilos.atlassian.bitbucket.cloud.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateCommentRequest(
        @JsonProperty("content") BitbucketCommentContent content
) {
    public static CreateCommentRequest of(String raw) {
        return new CreateCommentRequest(new BitbucketCommentContent(raw));
    }
}
