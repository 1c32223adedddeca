package org.rostilos.atlassian.bitbucket.cloud.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceObject;

import java.time.OffsetDateTime;

public class Commit extends ResourceObject {
    public static final String TYPE = "commit";

    public Commit(EndpointReference endpoint, JsonNode data) {
        super(endpoint, data, TYPE);
    }

    public String getHash() {
        return data().text("hash");
    }

    public String getMessage() {
        return data().text("message");
    }

    public OffsetDateTime getDate() {
        return data().time("date");
    }
}
