package org.rostilos.atlassian.bitbucket.cloud.dto.request;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record BitbucketCommentContent(String raw) {
    @JsonCreator
    public BitbucketCommentContent(@JsonProperty("raw") String raw) {
        this.raw = raw;
    }
}
