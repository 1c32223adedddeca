package org.rostilos.atlassian.bitbucket.cloud.pullrequests;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.bitbucket.cloud.common.User;
import org.rostilos.atlassian.bitbucket.cloud.dto.request.CreateCommentRequest;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceObject;

import java.io.IOException;
import java.time.OffsetDateTime;

public class Comment extends ResourceObject {
    public static final String TYPE = "pullrequest_comment";

    public Comment(EndpointReference endpoint, JsonNode data) {
        super(endpoint, data, TYPE);
    }

    public Integer getId() {
        return data().integer("id");
    }

    public String getRaw() {
        JsonNode raw = data().path("content", "raw");
        return raw.isMissingNode() || raw.isNull() ? null : raw.asText();
    }

    public User getUser() {
        JsonNode user = data().node("user");
        return user != null && user.isObject() ? new User(null, user) : null;
    }

    public boolean isDeleted() {
        return Boolean.TRUE.equals(data().bool("deleted"));
    }

    public OffsetDateTime getCreatedOn() {
        return data().time("created_on");
    }

    public OffsetDateTime getUpdatedOn() {
        return data().time("updated_on");
    }

    /**
     * Replaces the comment text. The returned comment reflects the server's copy;
     * this instance keeps its original snapshot.
     */
    public Comment update(String raw) throws IOException {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Comment text cannot be null or empty");
        }
        EndpointReference endpoint = requireEndpoint();
        JsonNode updated = endpoint.client().put(endpoint.url(), CreateCommentRequest.of(raw));
        return new Comment(endpoint, updated);
    }

    public void delete() throws IOException {
        EndpointReference endpoint = requireEndpoint();
        endpoint.client().delete(endpoint.url());
    }
}
