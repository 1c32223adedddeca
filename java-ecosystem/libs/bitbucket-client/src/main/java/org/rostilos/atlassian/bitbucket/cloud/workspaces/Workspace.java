package org.rostilos.atlassian.bitbucket.cloud.workspaces;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.atlassian.bitbucket.cloud.repositories.WorkspaceRepositories;
import org.rostilos.atlassian.restcore.resource.EndpointReference;
import org.rostilos.atlassian.restcore.resource.ResourceObject;

public class Workspace extends ResourceObject {
    public static final String TYPE = "workspace";

    public Workspace(EndpointReference endpoint, JsonNode data) {
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

    public boolean isPrivate() {
        return Boolean.TRUE.equals(data().bool("is_private"));
    }

    /**
     * Repositories live under {@code /repositories/{workspace}}, not below the workspace URL.
     */
    public WorkspaceRepositories repositories() {
        EndpointReference endpoint = requireEndpoint();
        return new WorkspaceRepositories(new EndpointReference(endpoint.client(), "repositories").child(getSlug()));
    }
}
