package org.rostilos.atlassian.bitbucket.cloud.workspaces;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceCollection;

/**
 * Workspaces visible to the authenticated account, addressed by slug.
 */
public class Workspaces extends ResourceCollection<Workspace> {

    public Workspaces(EndpointReference endpoint) {
        super(endpoint);
    }

    @Override
    protected Workspace wrap(EndpointReference itemEndpoint, JsonNode data) {
        return new Workspace(itemEndpoint, data);
    }

    @Override
    protected String itemId(JsonNode data) {
        return data.path("slug").asText();
    }
}
