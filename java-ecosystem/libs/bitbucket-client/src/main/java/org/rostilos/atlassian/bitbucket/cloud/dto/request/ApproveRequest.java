package org.rostilos.atlassian.bitbucket.cloud.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApproveRequest(
        @JsonProperty("approved") boolean approved
) {
}
