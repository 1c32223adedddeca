package org.rostilos.atlassian.bitbucket.cloud.common;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceObject;

/**
 * A Bitbucket account, usually embedded in another document.
 */
public class User extends ResourceObject {
    public static final String TYPE = "user";

    public User(EndpointReference endpoint, JsonNode data) {
        super(endpoint, data, TYPE);
    }

    public String getUuid() {
        return data().text("uuid");
    }

    public String getAccountId() {
        return data().text("account_id");
    }

    public String getNickname() {
        return data().text("nickname");
    }

    public String getDisplayName() {
        return data().text("display_name");
    }

    public String getAvatarUrl() {
        JsonNode href = data().path("links", "avatar", "href");
        return href.isMissingNode() || href.isNull() ? null : href.asText();
    }
}
