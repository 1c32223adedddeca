package org.rostilos.atlassian.bitbucket.cloud.repositories;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceCollection;

public class WorkspaceRepositories extends ResourceCollection<Repository> {

    public WorkspaceRepositories(EndpointReference endpoint) {
        super(endpoint);
    }

    @Override
    protected Repository wrap(EndpointReference itemEndpoint, JsonNode data) {
        return new Repository(itemEndpoint, data);
    }

    @Override
    protected String itemId(JsonNode data) {
        return data.path("slug").asText();
    }
}
