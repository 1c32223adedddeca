package org.rostilos.atlassian.bitbucket.cloud.repositories;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.bitbucket.cloud.pullrequests.PullRequests;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceObject;

import java.time.OffsetDateTime;

public class Repository extends ResourceObject {
    public static final String TYPE = "repository";

    public Repository(EndpointReference endpoint, JsonNode data) {
        super(endpoint, data, TYPE);
    }

    public String getUuid() {
        return data().text("uuid");
    }

    public String getSlug() {
        return data().text("slug");
    }

    public String getName() {
        return data().text("name");
    }

    public String getFullName() {
        return data().text("full_name");
    }

    public String getDescription() {
        return data().text("description");
    }

    public boolean isPrivate() {
        return Boolean.TRUE.equals(data().bool("is_private"));
    }

    public String getMainBranch() {
        JsonNode name = data().path("mainbranch", "name");
        return name.isMissingNode() || name.isNull() ? null : name.asText();
    }

    public OffsetDateTime getCreatedOn() {
        return data().time("created_on");
    }

    public OffsetDateTime getUpdatedOn() {
        return data().time("updated_on");
    }

    public PullRequests pullRequests() {
        return new PullRequests(requireEndpoint().child("pullrequests"));
    }
}
