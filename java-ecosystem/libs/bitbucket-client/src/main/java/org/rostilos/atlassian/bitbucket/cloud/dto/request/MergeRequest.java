package org.rostilos.atlassian.bitbucket.cloud.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"close_source_branch", "merge_strategy"})
public record MergeRequest(
        @JsonProperty("close_source_branch") Boolean closeSourceBranch,
        @JsonProperty("merge_strategy") String mergeStrategy
) {
}
